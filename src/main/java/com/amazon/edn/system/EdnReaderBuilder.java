// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.system;

import com.amazon.edn.EdnCollectionFactory;
import com.amazon.edn.EdnLoader;
import com.amazon.edn.EdnReader;
import com.amazon.edn.impl._Private_EdnReaderBuilder;

import java.io.Reader;

/**
 * Build a new {@link EdnReader} or {@link EdnLoader} over edn text.
 * <p>
 * {@link EdnReader}s parse incrementally, so syntax errors in the input data
 * will not be detected as side effects of any of the {@code build} methods
 * in this class.
 *
 * <h2>Obtaining and Usage</h2>
 * An {@code EdnReaderBuilder} with the default configuration may be
 * constructed as follows.
 * <pre>
 * EdnReaderBuilder readerBuilder = EdnReaderBuilder.standard();
 * </pre>
 * Builders can be configured by chaining calls to {@code with*()}
 * configuration methods. Below is a builder that rejects a comma directly
 * before a closing delimiter and treats {@code #_} as a syntax error.
 * <pre>
 * EdnReaderBuilder readerBuilder = EdnReaderBuilder.standard()
 *     .withTrailingCommasAllowed(false)
 *     .withDiscardEnabled(false);
 * </pre>
 *
 * <h3>Building a Reader over a Data Source</h3>
 * <pre>
 * try (EdnReader reader = EdnReaderBuilder.standard().build("{:hello \"world\"}")) {
 *     for (EdnEvent event : reader) {
 *         System.out.println(event);
 *     }
 * }
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * Mutable builders are not thread-safe; immutable ones, and the loaders
 * they build, may be shared.
 */
public abstract class EdnReaderBuilder
{
    private EdnCollectionFactory collectionFactory = SimpleCollectionFactory.INSTANCE;
    private boolean isTrailingCommasAllowed = true;
    private boolean isDiscardEnabled = true;
    private boolean isCommentsEnabled = true;

    protected EdnReaderBuilder()
    {
    }

    protected EdnReaderBuilder(EdnReaderBuilder that)
    {
        this.collectionFactory       = that.collectionFactory;
        this.isTrailingCommasAllowed = that.isTrailingCommasAllowed;
        this.isDiscardEnabled        = that.isDiscardEnabled;
        this.isCommentsEnabled       = that.isCommentsEnabled;
    }

    /**
     * The standard builder of {@link EdnReader}s, with all configuration
     * properties having their default values.
     *
     * @return a new, mutable builder instance.
     */
    public static EdnReaderBuilder standard()
    {
        return new _Private_EdnReaderBuilder.Mutable();
    }

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public EdnReaderBuilder copy()
    {
        return new _Private_EdnReaderBuilder.Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this builder instance, if immutable;
     * otherwise an immutable copy of this builder.
     */
    public EdnReaderBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public EdnReaderBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================

    /**
     * Declares the factory of the collections that loaders fill,
     * returning a new mutable builder if the current one is immutable.
     *
     * @param factory the factory to use in built loaders.
     *  If null, {@link SimpleCollectionFactory#INSTANCE} will be used.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setCollectionFactory(EdnCollectionFactory)
     */
    public EdnReaderBuilder withCollectionFactory(EdnCollectionFactory factory)
    {
        EdnReaderBuilder b = mutable();
        b.setCollectionFactory(factory);
        return b;
    }

    /**
     * @see #withCollectionFactory(EdnCollectionFactory)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setCollectionFactory(EdnCollectionFactory factory)
    {
        mutationCheck();
        this.collectionFactory =
            (factory == null) ? SimpleCollectionFactory.INSTANCE : factory;
    }

    /**
     * @return the factory loaders built from this builder will use;
     *  never null.
     */
    public EdnCollectionFactory getCollectionFactory()
    {
        return collectionFactory;
    }


    /**
     * Declares whether a comma may directly precede a closing delimiter.
     * Defaults to true, since commas are whitespace in edn.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setTrailingCommasAllowed(boolean)
     */
    public EdnReaderBuilder withTrailingCommasAllowed(boolean allowed)
    {
        EdnReaderBuilder b = mutable();
        b.setTrailingCommasAllowed(allowed);
        return b;
    }

    /**
     * @see #withTrailingCommasAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setTrailingCommasAllowed(boolean allowed)
    {
        mutationCheck();
        this.isTrailingCommasAllowed = allowed;
    }

    public boolean isTrailingCommasAllowed()
    {
        return isTrailingCommasAllowed;
    }


    /**
     * Declares whether {@code #_} discards the value that follows it.
     * When disabled, {@code #_} is a syntax error. Defaults to true.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setDiscardEnabled(boolean)
     */
    public EdnReaderBuilder withDiscardEnabled(boolean enabled)
    {
        EdnReaderBuilder b = mutable();
        b.setDiscardEnabled(enabled);
        return b;
    }

    /**
     * @see #withDiscardEnabled(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setDiscardEnabled(boolean enabled)
    {
        mutationCheck();
        this.isDiscardEnabled = enabled;
    }

    public boolean isDiscardEnabled()
    {
        return isDiscardEnabled;
    }


    /**
     * Declares whether {@code ;} starts a comment running to the end of the
     * line. When disabled, {@code ;} is a syntax error. Defaults to true.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setCommentsEnabled(boolean)
     */
    public EdnReaderBuilder withCommentsEnabled(boolean enabled)
    {
        EdnReaderBuilder b = mutable();
        b.setCommentsEnabled(enabled);
        return b;
    }

    /**
     * @see #withCommentsEnabled(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setCommentsEnabled(boolean enabled)
    {
        mutationCheck();
        this.isCommentsEnabled = enabled;
    }

    public boolean isCommentsEnabled()
    {
        return isCommentsEnabled;
    }


    //=========================================================================

    /**
     * Based on the builder's configuration properties, creates a new
     * {@link EdnReader} instance over the given source. Closing the reader
     * closes the source.
     *
     * @param ednText the source of edn text; not null.
     *
     * @return a new {@link EdnReader} instance; not {@code null}.
     */
    public abstract EdnReader build(Reader ednText);

    /**
     * Based on the builder's configuration properties, creates a new
     * {@link EdnReader} instance over the given text.
     *
     * @param ednText the edn text; not null.
     *
     * @return a new {@link EdnReader} instance; not {@code null}.
     */
    public abstract EdnReader build(CharSequence ednText);

    /**
     * Creates a loader that reads with an immutable copy of this builder's
     * configuration.
     *
     * @return a new, thread-safe {@link EdnLoader}; not {@code null}.
     */
    public abstract EdnLoader buildLoader();
}
