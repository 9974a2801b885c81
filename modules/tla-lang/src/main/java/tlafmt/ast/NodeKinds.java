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
package tlafmt.ast;

/**
 * Kind labels of the syntax tree nodes produced by the parser.
 *
 * Leaf kinds for keywords are the keyword itself (e.g. `LET`),
 * punctuation uses its literal text (e.g. `(`).
 */
public final class NodeKinds {

    // structure
    public static final String SOURCE_FILE = "source_file";
    public static final String MODULE = "module";
    public static final String HEADER_LINE = "header_line";
    public static final String SINGLE_LINE = "single_line";
    public static final String DOUBLE_LINE = "double_line";
    public static final String EXTRAMODULAR_TEXT = "extramodular_text";
    public static final String ERROR = "ERROR";

    // comments
    public static final String COMMENT = "comment";
    public static final String BLOCK_COMMENT = "block_comment";

    // units
    public static final String EXTENDS = "extends";
    public static final String CONSTANT_DECLARATION = "constant_declaration";
    public static final String VARIABLE_DECLARATION = "variable_declaration";
    public static final String OPERATOR_DECLARATION = "operator_declaration";
    public static final String RECURSIVE_DECLARATION = "recursive_declaration";
    public static final String OPERATOR_DEFINITION = "operator_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String MODULE_DEFINITION = "module_definition";
    public static final String LOCAL_DEFINITION = "local_definition";
    public static final String INSTANCE = "instance";
    public static final String SUBSTITUTION = "substitution";
    public static final String THEOREM = "theorem";
    public static final String ASSUMPTION = "assumption";

    // expressions
    public static final String IDENTIFIER = "identifier";
    public static final String IDENTIFIER_REF = "identifier_ref";
    public static final String PLACEHOLDER = "placeholder";
    public static final String NAT_NUMBER = "nat_number";
    public static final String REAL_NUMBER = "real_number";
    public static final String STRING = "string";
    public static final String BOOLEAN = "boolean";
    public static final String PREV_FUNC_VAL = "prev_func_val";
    public static final String BOUND_INFIX_OP = "bound_infix_op";
    public static final String BOUND_PREFIX_OP = "bound_prefix_op";
    public static final String BOUND_POSTFIX_OP = "bound_postfix_op";
    public static final String BOUND_OP = "bound_op";
    public static final String FUNCTION_EVALUATION = "function_evaluation";
    public static final String RECORD_VALUE = "record_value";
    public static final String PARENTHESES = "parentheses";
    public static final String TUPLE_LITERAL = "tuple_literal";
    public static final String TUPLE_OF_IDENTIFIERS = "tuple_of_identifiers";
    public static final String FINITE_SET_LITERAL = "finite_set_literal";
    public static final String SET_FILTER = "set_filter";
    public static final String SET_MAP = "set_map";
    public static final String FUNCTION_LITERAL = "function_literal";
    public static final String SET_OF_FUNCTIONS = "set_of_functions";
    public static final String RECORD_LITERAL = "record_literal";
    public static final String SET_OF_RECORDS = "set_of_records";
    public static final String EXCEPT = "except";
    public static final String EXCEPT_UPDATE = "except_update";
    public static final String EXCEPT_UPDATE_SPECIFIER = "except_update_specifier";
    public static final String EXCEPT_UPDATE_RECORD_FIELD = "except_update_record_field";
    public static final String EXCEPT_UPDATE_FN_APPL = "except_update_fn_appl";
    public static final String BOUNDED_QUANTIFICATION = "bounded_quantification";
    public static final String UNBOUNDED_QUANTIFICATION = "unbounded_quantification";
    public static final String QUANTIFIER_BOUND = "quantifier_bound";
    public static final String CHOOSE = "choose";
    public static final String LAMBDA = "lambda";
    public static final String IF_THEN_ELSE = "if_then_else";
    public static final String CASE = "case";
    public static final String CASE_ARM = "case_arm";
    public static final String OTHER_ARM = "other_arm";
    public static final String CASE_BOX = "case_box";
    public static final String CASE_ARROW = "case_arrow";
    public static final String LET_IN = "let_in";
    public static final String CONJ_LIST = "conj_list";
    public static final String CONJ_ITEM = "conj_item";
    public static final String DISJ_LIST = "disj_list";
    public static final String DISJ_ITEM = "disj_item";
    public static final String BULLET_CONJ = "bullet_conj";
    public static final String BULLET_DISJ = "bullet_disj";
    public static final String STEP_EXPR_OR_STUTTER = "step_expr_or_stutter";
    public static final String STEP_EXPR_NO_STUTTER = "step_expr_no_stutter";
    public static final String FAIRNESS = "fairness";

    // operator symbols
    public static final String OPERATOR = "operator";
    public static final String SET_IN = "set_in";
    public static final String DEF_EQ = "def_eq";

    private NodeKinds() {}
}
