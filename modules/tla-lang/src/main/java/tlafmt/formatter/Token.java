/*
 * Copyright 2024-2025, Seqera Labs
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tlafmt.formatter;

import com.google.common.base.Strings;

/**
 * Output token produced by lowering a syntax tree.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public sealed interface Token permits Symbol, Token.Raw, Token.Ident, Token.Lit, Token.Comment,
        Token.ModuleHeader, Token.LineDivider, Token.StepOrStutter, Token.SourceNewline, Token.Newline {

    Token SOURCE_NEWLINE = new SourceNewline();

    Token NEWLINE = new Newline();

    /**
     * Get the rendered text of the token.
     */
    String text();

    /**
     * Get the number of columns taken by the rendered token
     * when it fits on one line.
     */
    int width();

    default boolean isNewline() {
        return false;
    }

    /**
     * Source text passed through verbatim.
     */
    record Raw(String text) implements Token {
        @Override
        public int width() {
            return text.length();
        }
    }

    record Ident(String name) implements Token {
        @Override
        public String text() {
            return name;
        }

        @Override
        public int width() {
            return name.length();
        }
    }

    record Lit(String value) implements Token {
        @Override
        public String text() {
            return value;
        }

        @Override
        public int width() {
            return value.length();
        }
    }

    record Comment(String text, Position position) implements Token {
        @Override
        public int width() {
            var newline = text.indexOf('\n');
            return newline < 0 ? text.length() : newline;
        }

        public boolean isLineComment() {
            return text.startsWith("\\*");
        }

        public Comment withPosition(Position position) {
            return new Comment(text, position);
        }
    }

    /**
     * Module header line with the module name centered in dashes.
     */
    record ModuleHeader(String name, int lineWidth) implements Token {

        private static final String MODULE = " MODULE ";

        private int dashes() {
            var free = lineWidth - name.length() - MODULE.length() - 1;
            return free < 0 ? 1 : free / 2;
        }

        private int extraDash() {
            return 2 * dashes() + MODULE.length() + 1 + name.length() == lineWidth - 1 ? 1 : 0;
        }

        @Override
        public String text() {
            var dashes = dashes();
            return Strings.repeat("-", dashes) + MODULE + name + " " + Strings.repeat("-", dashes + extraDash());
        }

        @Override
        public int width() {
            return 2 * dashes() + extraDash() + MODULE.length() + 1 + name.length();
        }
    }

    record LineDivider(char fill, int lineWidth) implements Token {
        @Override
        public String text() {
            return Strings.repeat(String.valueOf(fill), lineWidth);
        }

        @Override
        public int width() {
            return lineWidth;
        }
    }

    /**
     * Step-or-stutter prefix, e.g. {@code [Next]_}, followed
     * by the subscript token.
     */
    record StepOrStutter(String action) implements Token {
        @Override
        public String text() {
            return "[" + action + "]_";
        }

        @Override
        public int width() {
            return action.length() + 3;
        }
    }

    /**
     * Line break that reproduces a line break of the source.
     */
    record SourceNewline() implements Token {
        @Override
        public String text() {
            return "\n";
        }

        @Override
        public int width() {
            return 0;
        }

        @Override
        public boolean isNewline() {
            return true;
        }
    }

    /**
     * Line break required by the layout. It is dropped when the
     * previous token already ended the line.
     */
    record Newline() implements Token {
        @Override
        public String text() {
            return "\n";
        }

        @Override
        public int width() {
            return 0;
        }

        @Override
        public boolean isNewline() {
            return true;
        }
    }
}
