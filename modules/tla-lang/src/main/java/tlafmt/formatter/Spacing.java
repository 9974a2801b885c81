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

import static tlafmt.formatter.Symbol.*;

/**
 * Adjacency and spacing rules between consecutive output tokens.
 */
public final class Spacing {

    private Spacing() {}

    /**
     * Whether the first token may be emitted directly before the
     * next one. A separator in front of a closing delimiter is dropped.
     *
     * @param first
     * @param next
     */
    public static boolean canPrecede(Token first, Token next) {
        if( first != COMMA )
            return true;
        return next != PAREN_CLOSE && next != SQUARE_CLOSE && next != CURLY_CLOSE && next != ANGLE_CLOSE;
    }

    /**
     * Get the number of spaces to write between two emitted tokens.
     *
     * @param prev
     * @param next
     */
    public static int delimitingSpaceLen(Token prev, Token next) {
        if( next instanceof Token.Comment comment && comment.position() instanceof Position.Relative relative )
            return relative.padding();
        if( next instanceof Token.ModuleHeader )
            return 0;
        if( next.isNewline() || prev.isNewline() || endsWithNewline(prev) )
            return 0;

        // never followed by a space
        if( prev == PAREN_OPEN || prev == SQUARE_OPEN || prev == CURLY_OPEN || prev == DOTS_2
                || prev == NOT || prev == NEGATIVE || prev == WF || prev == SF || prev == ANGLE_CLOSE_STEP
                || prev instanceof Token.StepOrStutter )
            return 0;

        // never preceded by a space
        if( next == PAREN_CLOSE || next == SQUARE_CLOSE || next == CURLY_CLOSE || next == COMMA
                || next == DOTS_2 || next == COLON || next == PRIME || next == DOT )
            return 0;

        if( prev instanceof Token.Raw || next instanceof Token.Raw )
            return 1;

        // function and operator application
        if( next == SQUARE_OPEN && (prev instanceof Token.Ident || prev == SQUARE_CLOSE || prev == PAREN_CLOSE) )
            return 0;
        if( next == PAREN_OPEN && (prev instanceof Token.Ident || prev == ALWAYS || prev == EVENTUALLY) )
            return 0;

        // chained temporal operators, e.g. <>[]P and [][Next]_vars
        if( (prev == ALWAYS || prev == EVENTUALLY)
                && (next == ALWAYS || next == EVENTUALLY || next instanceof Token.StepOrStutter) )
            return 0;

        // record fields and EXCEPT specifiers
        if( prev == DOT && next instanceof Token.Ident )
            return 0;
        if( prev == BANG && (next == DOT || next == SQUARE_OPEN) )
            return 0;

        if( prev == ANGLE_OPEN && next == ANGLE_CLOSE )
            return 0;

        return 1;
    }

    private static boolean endsWithNewline(Token token) {
        return (token instanceof Token.Raw || token instanceof Token.Comment) && token.text().endsWith("\n");
    }
}
