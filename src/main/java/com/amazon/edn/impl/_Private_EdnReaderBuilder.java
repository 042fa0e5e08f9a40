// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnLoader;
import com.amazon.edn.EdnReader;
import com.amazon.edn.system.EdnReaderBuilder;

import java.io.Reader;
import java.io.StringReader;

/**
 * {@link EdnReaderBuilder} extension for internal use only.
 */
public class _Private_EdnReaderBuilder extends EdnReaderBuilder {

    private _Private_EdnReaderBuilder() {
        super();
    }

    private _Private_EdnReaderBuilder(EdnReaderBuilder that) {
        super(that);
    }

    public static class Mutable extends _Private_EdnReaderBuilder {

        public Mutable() {
        }

        public Mutable(EdnReaderBuilder that) {
            super(that);
        }

        @Override
        public EdnReaderBuilder immutable() {
            return new _Private_EdnReaderBuilder(this);
        }

        @Override
        public EdnReaderBuilder mutable() {
            return this;
        }

        @Override
        protected void mutationCheck() {
        }

    }

    @Override
    public EdnReader build(Reader ednText) {
        if (ednText == null) {
            throw new NullPointerException("ednText");
        }
        return new EdnReaderTextX(ednText,
                                  isTrailingCommasAllowed(),
                                  isDiscardEnabled(),
                                  isCommentsEnabled());
    }

    @Override
    public EdnReader build(CharSequence ednText) {
        if (ednText == null) {
            throw new NullPointerException("ednText");
        }
        return build(new StringReader(ednText.toString()));
    }

    @Override
    public EdnLoader buildLoader() {
        return new EdnLoaderImpl(immutable());
    }
}
