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

import java.util.Random;

import com.google.common.base.Strings;
import org.junit.jupiter.api.Test;
import tlafmt.ast.SyntaxNode;
import tlafmt.control.ParsedDocument;
import tlafmt.exception.ModuleHeaderException;
import tlafmt.exception.StepOrStutterException;
import tlafmt.exception.TlaFormatException;

import static org.junit.jupiter.api.Assertions.*;

class FormatterTest {

    private static final String DIVIDER = Strings.repeat("=", 80);

    private static String header(String name) {
        var free = 80 - name.length() - 9;
        var dashes = free / 2;
        var extra = 2 * dashes + name.length() + 9 == 79 ? 1 : 0;
        return Strings.repeat("-", dashes) + " MODULE " + name + " " + Strings.repeat("-", dashes + extra);
    }

    private static String module(String body) {
        return "---- MODULE T ----\n" + body + "\n====\n";
    }

    private static String formatted(String body) {
        return header("T") + "\n" + body + "\n" + DIVIDER + "\n";
    }

    private static String format(String text) throws TlaFormatException {
        return ParsedDocument.parse(text).format();
    }

    private static String format(String text, FormattingOptions options) throws TlaFormatException {
        return ParsedDocument.parse(text).format(options);
    }

    /**
     * Format the given text and check that formatting the result
     * again does not change it.
     */
    private static String checkFormat(String text) throws TlaFormatException {
        var result = format(text);
        assertEquals(result, format(result), "formatting is not idempotent");
        return result;
    }

    @Test
    void shouldFormatModule() throws TlaFormatException {
        var text = "---- MODULE Test ----\nEXTENDS Naturals,Sequences\nVARIABLE x\n\n\n\nInit == x=0\n====\n";
        var expected = header("Test") + "\nEXTENDS Naturals, Sequences\nVARIABLE x\n\nInit == x = 0\n" + DIVIDER + "\n";
        assertEquals(expected, checkFormat(text));
    }

    @Test
    void shouldPlaceListItemsOnOwnLines() throws TlaFormatException {
        var text = module("Next == /\\ x' = x + 1\n        /\\ y' = y");
        assertEquals(formatted("Next ==\n    /\\ x' = x + 1\n    /\\ y' = y"), checkFormat(text));
    }

    @Test
    void shouldFormatCase() throws TlaFormatException {
        var text = module("X == CASE a -> 1\n  [] OTHER -> 2");
        assertEquals(formatted("X == CASE a -> 1\n    [] OTHER -> 2"), checkFormat(text));
    }

    @Test
    void shouldSplitOneLineCaseIntoArms() throws TlaFormatException {
        var text = module("X == CASE a -> 1 [] b -> 2 [] OTHER -> 3");
        assertEquals(formatted("X == CASE a -> 1\n    [] b -> 2\n    [] OTHER -> 3"), checkFormat(text));
    }

    @Test
    void shouldIndentFirstCommentOfOperatorBody() throws TlaFormatException {
        var text = module("Op ==\n  \\* first\n  x");
        assertEquals(formatted("Op ==\n    \\* first\nx"), checkFormat(text));
    }

    @Test
    void shouldAlignTrailingComments() throws TlaFormatException {
        var text = module("x == {1,2,3}   \\* one\ny == 1         \\* two");
        assertEquals(formatted("x == {1, 2, 3} \\* one\ny == 1         \\* two"), checkFormat(text));
    }

    @Test
    void shouldAlignCommentsBeforeLimitingIndentation() throws TlaFormatException {
        // the second binder is indented two levels, the limiter moves it back by one
        var text = module(
            "F == LET a == 1             \\* one\n"
            + "         b == 2 IN a + b    \\* two");
        var expected = formatted(
            "F == LET a == 1             \\* one\n"
            + "    b == 2 IN a + b     \\* two");
        assertEquals(expected, format(text));
    }

    @Test
    void shouldRenderLineBreaksWithAssertionsEnabled() throws TlaFormatException {
        assertTrue(Renderer.class.desiredAssertionStatus(), "assertions must be enabled");
        var text = module("Next == /\\ x' = x + 1\n        /\\ y' = y\n\n\n\nInit == x = 0");
        assertEquals(formatted("Next ==\n    /\\ x' = x + 1\n    /\\ y' = y\n\nInit == x = 0"), format(text));
    }

    @Test
    void shouldFormatDeeplyNestedValues() throws TlaFormatException {
        var text = module("x == " + Strings.repeat("f([a |-> {", 20) + "1" + Strings.repeat("}])", 20));
        var result = checkFormat(text);
        assertTrue(result.contains("1" + Strings.repeat("}])", 20)));
    }

    @Test
    void shouldFormatStepExpression() throws TlaFormatException {
        var text = module("Spec == Init /\\ [][Next]_vars /\\ WF_vars(Next)");
        assertEquals(formatted("Spec == Init /\\ [][Next]_vars /\\ WF_vars(Next)"), checkFormat(text));
    }

    @Test
    void shouldUseCanonicalOperators() throws TlaFormatException {
        var text = module("S == (A \\cup B) \\cap C\nN == x # y");
        assertEquals(formatted("S == (A \\union B) \\intersect C\nN == x /= y"), checkFormat(text));
    }

    @Test
    void shouldPassThroughSyntaxErrors() throws TlaFormatException {
        var options = FormattingOptions.defaults().withReportDiagnostics(false);
        var text = module("x == 1\ny == == 2\nz == 3");
        assertEquals(formatted("x == 1\ny == == 2\nz == 3"), format(text, options));
    }

    @Test
    void shouldPassThroughDocumentWithoutModule() throws TlaFormatException {
        var options = FormattingOptions.defaults().withReportDiagnostics(false);
        assertEquals("hello   world\n", format("hello   world\n", options));
        assertEquals("", format("", options));
    }

    @Test
    void shouldKeepTextOutsideModule() throws TlaFormatException {
        var text = "Some text\n---- MODULE T ----\n====\nafter\n";
        assertEquals("Some text\n" + header("T") + "\n" + DIVIDER + "\nafter\n", checkFormat(text));
    }

    @Test
    void shouldNotAddFinalNewline() throws TlaFormatException {
        assertEquals(header("T") + "\nx == 1\n" + DIVIDER, format("---- MODULE T ----\nx == 1\n===="));
    }

    @Test
    void shouldApplyOptions() throws TlaFormatException {
        var options = new FormattingOptions(40, 2, false);
        var text = module("Next == /\\ x' = x + 1\n        /\\ y' = y");
        var expected = Strings.repeat("-", 15) + " MODULE T " + Strings.repeat("-", 15) + "\n"
            + "Next ==\n  /\\ x' = x + 1\n  /\\ y' = y\n"
            + Strings.repeat("=", 40) + "\n";
        assertEquals(expected, format(text, options));
    }

    @Test
    void shouldBeIdempotent() throws TlaFormatException {
        checkFormat(module("F == LET a == 1\n         b == 2\n     IN a + b"));
        checkFormat(module("A == /\\ x = 1\n     /\\ y = \\/ p\n            \\/ q"));
        checkFormat(module("U == [f EXCEPT ![1] = 2, !.a = @]\nR == [a |-> 1, b |-> 2]"));
        checkFormat(module("S == {x \\in T : x > 1}\nM == {x + 1 : x \\in T}"));
        checkFormat(module("I == IF x > 0\n     THEN 1\n     ELSE 2"));
        checkFormat(module("\\* leading\nx == 1 \\* trailing\n\n(* block\n   comment *)\ny == 2"));
    }

    @Test
    void shouldRejectIncompleteModuleHeader() {
        assertThrows(ModuleHeaderException.class, () -> format("---- MODULE ----\n====\n"));
        var e = assertThrows(ModuleHeaderException.class, () -> format("---- MODULE Foo\nx == 1\n====\n"));
        assertNotNull(e.getPosition());
    }

    @Test
    void shouldRejectStepWithoutSubscript() {
        var e = assertThrows(StepOrStutterException.class, () -> format(module("Spec == [][Next]_")));
        assertTrue(e.getMessage().contains("subscript"));
    }

    @Test
    void shouldRejectStepWithoutAction() {
        var e = assertThrows(StepOrStutterException.class, () -> format(module("Spec == [][ ]_vars")));
        assertTrue(e.getMessage().contains("action"));
    }

    private static final String[] VOCABULARY = {
        "x", "y", "Op", "WF_vars", "SF_", "1", "2.5", "\"s\"", "==", "=", "#", "/\\", "\\/", "~", "=>",
        "(", ")", "[", "]", "{", "}", "<<", ">>", ">>_", "]_", ",", ":", ".", "..", "!", "@", "'",
        "\\in", "\\A", "\\E", "|->", "->", "[]", "<>", "LET", "IN", "IF", "THEN", "ELSE", "CASE",
        "OTHER", "CHOOSE", "EXCEPT", "VARIABLE", "CONSTANT", "EXTENDS", "LOCAL", "INSTANCE", "WITH",
        "ASSUME", "THEOREM", "LAMBDA", "UNCHANGED", "ENABLED", "SUBSET", "DOMAIN", "TRUE",
        "\\* c", "(* c *)", "----", "====", "---- MODULE M ----", "$", "\\cup", "\\o", "-", "+"
    };

    private static String randomText(Random random) {
        var builder = new StringBuilder();
        var count = random.nextInt(40);
        for( int i = 0; i < count; i++ ) {
            builder.append(VOCABULARY[random.nextInt(VOCABULARY.length)]);
            switch( random.nextInt(4) ) {
                case 0 -> builder.append('\n');
                case 1 -> builder.append('\n').append(Strings.repeat(" ", random.nextInt(12)));
                default -> builder.append(' ');
            }
        }
        return builder.toString();
    }

    private static boolean hasError(SyntaxNode node) {
        if( node.isError() )
            return true;
        for( var child : node.children() ) {
            if( hasError(child) )
                return true;
        }
        return false;
    }

    @Test
    void shouldFormatArbitraryInput() throws TlaFormatException {
        var options = FormattingOptions.defaults().withReportDiagnostics(false);
        var random = new Random(42);
        for( int i = 0; i < 500; i++ ) {
            var body = randomText(random);
            for( var text : new String[] { body, module(body) } ) {
                ParsedDocument document;
                String result;
                try {
                    document = ParsedDocument.parse(text);
                    result = document.format(options);
                }
                catch( TlaFormatException e ) {
                    // declared failures are allowed
                    continue;
                }
                if( !hasError(document.getRoot()) )
                    assertEquals(result, format(result, options), "formatting is not idempotent for: " + text);
            }
        }
    }
}
