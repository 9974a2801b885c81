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
package tlafmt.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;

import static tlafmt.parser.TlaParser.ConjItemContext;
import static tlafmt.parser.TlaParser.DisjItemContext;

/**
 * Semantic predicates for the column-sensitive parts of the grammar.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class SemanticPredicates {

    /**
     * Check whether the next token may continue an expression,
     * i.e. it lies to the right of the bullet of the innermost
     * enclosing conjunction or disjunction item.
     *
     * @param input
     * @param context the context of the expression being parsed
     */
    public static boolean isRightOfBullet(TokenStream input, ParserRuleContext context) {
        for( var ctx = context; ctx != null; ctx = ctx.getParent() ) {
            if( ctx instanceof ConjItemContext || ctx instanceof DisjItemContext ) {
                var bullet = ctx.getStart();
                return input.LT(1).getCharPositionInLine() > bullet.getCharPositionInLine();
            }
        }
        return true;
    }

    /**
     * Check whether the next token is a bullet of the same kind
     * and in the same column as the first bullet of a list.
     *
     * @param input
     * @param list
     */
    public static boolean continuesList(TokenStream input, ParserRuleContext list) {
        var first = list.getStart();
        var next = input.LT(1);
        return next.getType() == first.getType()
            && next.getCharPositionInLine() == first.getCharPositionInLine();
    }

    /**
     * Check whether the next tokens are a fairness condition,
     * either {@code WF_vars(A)} or {@code WF_ <<x, y>>(A)}.
     *
     * @param input
     */
    public static boolean isFairness(TokenStream input) {
        var token = input.LT(1);
        if( token.getType() != TlaLexer.IDENTIFIER )
            return false;
        var text = token.getText();
        if( !text.startsWith("WF_") && !text.startsWith("SF_") )
            return false;
        return text.length() == 3 || input.LA(2) == TlaLexer.LPAREN;
    }

    /**
     * Check whether the next token is a fairness prefix without
     * the subscript glued to it.
     *
     * @param input
     */
    public static boolean isBareFairness(TokenStream input) {
        return input.LT(1).getText().length() == 3;
    }

    /**
     * Check whether the next tokens continue a module instance
     * path such as {@code M!Op}, which is written without spaces.
     *
     * @param input
     */
    public static boolean isInstancePath(TokenStream input) {
        var previous = input.LT(-1);
        var bang = input.LT(1);
        var next = input.LT(2);
        if( previous == null || bang.getType() != TlaLexer.BANG )
            return false;
        if( next.getType() != TlaLexer.IDENTIFIER && next.getType() != TlaLexer.NUMBER )
            return false;
        return bang.getStartIndex() == previous.getStopIndex() + 1
            && next.getStartIndex() == bang.getStopIndex() + 1;
    }

}
