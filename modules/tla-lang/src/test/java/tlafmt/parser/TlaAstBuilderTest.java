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

import com.google.common.base.Strings;
import org.junit.jupiter.api.Test;
import tlafmt.ast.NodeKinds;
import tlafmt.ast.SyntaxNode;
import tlafmt.ast.TreeNode;
import tlafmt.exception.ParseException;

import static org.junit.jupiter.api.Assertions.*;

class TlaAstBuilderTest {

    private static TreeNode parse(String text) throws ParseException {
        return new TlaAstBuilder(text).buildAST();
    }

    private static String module(String body) {
        return "---- MODULE T ----\n" + body + "\n====\n";
    }

    private static SyntaxNode unit(TreeNode root, int index) {
        // skip the header line, module name and header line
        return root.namedChild(0).namedChild(3 + index);
    }

    @Test
    void shouldParseModule() throws ParseException {
        var root = parse("---- MODULE Test ----\nEXTENDS Naturals\nVARIABLE x\nInit == x = 0\n====\n");
        assertEquals(
            "(source_file (module (header_line) (identifier) (header_line) (extends (identifier_ref)) (variable_declaration (identifier)) (operator_definition (identifier) (bound_infix_op (identifier_ref) (nat_number))) (double_line)))",
            root.toString());
        assertEquals("Test", root.namedChild(0).namedChild(1).text());
    }

    @Test
    void shouldParseConjunctionList() throws ParseException {
        var root = parse(module("Next == /\\ x' = 1\n        /\\ y"));
        assertEquals(
            "(operator_definition (identifier) (conj_list (conj_item (bullet_conj) (bound_infix_op (bound_postfix_op (identifier_ref)) (nat_number))) (conj_item (bullet_conj) (identifier_ref))))",
            unit(root, 0).toString());
    }

    @Test
    void shouldEndListItemAtBulletColumn() throws ParseException {
        var root = parse(module("A == /\\ \\/ p\n        \\/ q\n     /\\ r"));
        assertEquals(
            "(operator_definition (identifier) (conj_list (conj_item (bullet_conj) (disj_list (disj_item (bullet_disj) (identifier_ref)) (disj_item (bullet_disj) (identifier_ref)))) (conj_item (bullet_conj) (identifier_ref))))",
            unit(root, 0).toString());
    }

    @Test
    void shouldParseStepExpression() throws ParseException {
        var root = parse(module("Spec == Init /\\ [][Next]_vars /\\ WF_vars(Next)"));
        assertEquals(
            "(operator_definition (identifier) (bound_infix_op (bound_infix_op (identifier_ref) (bound_prefix_op (step_expr_or_stutter (identifier_ref) (identifier_ref)))) (fairness (identifier_ref) (identifier_ref))))",
            unit(root, 0).toString());
    }

    @Test
    void shouldParseCase() throws ParseException {
        var root = parse(module("X == CASE a -> 1 [] OTHER -> 2"));
        assertEquals(
            "(operator_definition (identifier) (case (case_arm (identifier_ref) (nat_number)) (case_box) (other_arm (nat_number))))",
            unit(root, 0).toString());
    }

    @Test
    void shouldParseSetsAndFunctions() throws ParseException {
        var root = parse(module("S == {x \\in T : x > 1}\nM == {x + 1 : x \\in T}\nF == [x \\in T |-> x]\nR == [a |-> 1, b |-> 2]"));
        assertEquals("(operator_definition (identifier) (set_filter (quantifier_bound (identifier) (identifier_ref)) (bound_infix_op (identifier_ref) (nat_number))))", unit(root, 0).toString());
        assertEquals("(operator_definition (identifier) (set_map (bound_infix_op (identifier_ref) (nat_number)) (quantifier_bound (identifier) (identifier_ref))))", unit(root, 1).toString());
        assertEquals("(operator_definition (identifier) (function_literal (quantifier_bound (identifier) (identifier_ref)) (identifier_ref)))", unit(root, 2).toString());
        assertEquals("(operator_definition (identifier) (record_literal (identifier) (nat_number) (identifier) (nat_number)))", unit(root, 3).toString());
    }

    @Test
    void shouldParseExcept() throws ParseException {
        var root = parse(module("U == [f EXCEPT ![1] = 2, !.a = @]"));
        assertEquals(
            "(operator_definition (identifier) (except (identifier_ref) (except_update (except_update_specifier (except_update_fn_appl (nat_number))) (nat_number)) (except_update (except_update_specifier (except_update_record_field (identifier_ref))) (prev_func_val))))",
            unit(root, 0).toString());
    }

    @Test
    void shouldJoinInstancePrefix() throws ParseException {
        var root = parse(module("X == M!Op(1)"));
        var op = unit(root, 0).namedChild(1);
        assertEquals(NodeKinds.BOUND_OP, op.kind());
        assertEquals("M!Op", op.namedChild(0).text());
    }

    @Test
    void shouldAttachComments() throws ParseException {
        var root = parse("---- MODULE T ----\n\\* lead\nx == 1 \\* trail\n====\n");
        assertEquals(
            "(source_file (module (header_line) (identifier) (header_line) (comment) (operator_definition (identifier) (nat_number)) (comment) (double_line)))",
            root.toString());
        assertEquals("\\* trail", unit(root, 2).text());
    }

    @Test
    void shouldRecoverFromSyntaxError() throws ParseException {
        var root = parse(module("x == 1\ny == == 2\nz == 3"));
        var error = unit(root, 1);
        assertTrue(error.isError());
        assertEquals("y == == 2", error.text());
        assertEquals(NodeKinds.OPERATOR_DEFINITION, unit(root, 2).kind());
        assertEquals(NodeKinds.DOUBLE_LINE, unit(root, 3).kind());
    }

    @Test
    void shouldKeepTextOutsideModule() throws ParseException {
        var root = parse("intro text\n---- MODULE T ----\n====\ntrailer\n");
        assertEquals("(source_file (extramodular_text) (module (header_line) (identifier) (header_line) (double_line)) (extramodular_text))", root.toString());
        assertEquals("intro text", root.namedChild(0).text());
        assertEquals("trailer", root.namedChild(2).text());
    }

    @Test
    void shouldParseDocumentWithoutModule() throws ParseException {
        assertEquals("(source_file (ERROR))", parse("hello world").toString());
        assertEquals("(source_file)", parse("").toString());
    }

    @Test
    void shouldTrackPositions() throws ParseException {
        var root = parse(module("x ==\n  1"));
        var definition = unit(root, 0);
        assertEquals(1, definition.startPosition().row());
        assertEquals(2, definition.endPosition().row());
        assertEquals(3, definition.endPosition().column());
        assertSame(root.namedChild(0), definition.parent());
    }

    @Test
    void shouldParseNestedValues() throws ParseException {
        var text = module("x == " + Strings.repeat("f([a |-> {", 20) + "1" + Strings.repeat("}])", 20));
        var root = parse(text);
        assertFalse(unit(root, 0).isError());
        assertEquals(NodeKinds.OPERATOR_DEFINITION, unit(root, 0).kind());
    }

    @Test
    void shouldRejectDeepNesting() {
        var text = module("x == " + Strings.repeat("(", 100) + "1" + Strings.repeat(")", 100));
        assertThrows(ParseException.class, () -> parse(text));
    }

    @Test
    void shouldLexUnknownCharacters() throws ParseException {
        var root = parse(module("x == 1\ny == $ 2"));
        assertTrue(unit(root, 1).isError());
    }
}
