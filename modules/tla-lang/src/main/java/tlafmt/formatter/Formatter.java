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

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tlafmt.ast.NodeKinds;
import tlafmt.ast.SyntaxNode;
import tlafmt.exception.ModuleHeaderException;
import tlafmt.exception.StepOrStutterException;
import tlafmt.exception.StructuralException;

import static tlafmt.formatter.Symbol.*;

/**
 * Lower a syntax tree into a sequence of output tokens, each with
 * an indentation depth, and render them.
 *
 * Composite nodes indent their children unless an enclosing node
 * that starts on the same line has already done so. Comments,
 * list items, case expressions and step expressions have their
 * own lowering.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class Formatter {

    private static final Logger log = LoggerFactory.getLogger(Formatter.class);

    private static final Map<String,Symbol> SYMBOLS = ImmutableMap.<String,Symbol>builder()
        // keywords
        .put("LET", LET)
        .put("IN", IN)
        .put("CHOOSE", CHOOSE)
        .put("LOCAL", LOCAL)
        .put("IF", IF)
        .put("THEN", THEN)
        .put("ELSE", ELSE)
        .put("CASE", CASE)
        .put("OTHER", OTHER)
        .put("INSTANCE", INSTANCE)
        .put("WITH", WITH)
        .put("EXTENDS", EXTENDS)
        .put("CONSTANT", CONSTANT)
        .put("CONSTANTS", CONSTANTS)
        .put("VARIABLE", VARIABLE)
        .put("VARIABLES", VARIABLES)
        .put("EXCEPT", EXCEPT)
        .put("THEOREM", THEOREM)
        .put("LEMMA", LEMMA)
        .put("PROPOSITION", PROPOSITION)
        .put("COROLLARY", COROLLARY)
        .put("ASSUME", ASSUME)
        .put("ASSUMPTION", ASSUMPTION)
        .put("AXIOM", AXIOM)
        .put("RECURSIVE", RECURSIVE)
        .put("LAMBDA", LAMBDA)
        .put("UNCHANGED", UNCHANGED)
        .put("ENABLED", ENABLED)
        .put("SUBSET", SUBSET)
        .put("UNION", UNION)
        .put("DOMAIN", DOMAIN)
        .put("TRUE", TRUE)
        .put("FALSE", FALSE)
        .put("boolean_set", BOOLEAN)
        .put("string_set", STRING)
        .put("nat_number_set", NAT)
        .put("int_number_set", INT)
        .put("real_number_set", REAL)
        // operators
        .put("implies", IMPLIES)
        .put("equiv", EQUIV)
        .put("leads_to", LEADS_TO)
        .put("land", AND)
        .put("lor", OR)
        .put("lnot", NOT)
        .put("eq", EQ)
        .put("=", EQ)
        .put("neq", NEQ)
        .put("lt", LT)
        .put("gt", GT)
        .put("leq", LEQ)
        .put("geq", GEQ)
        .put("plus", PLUS)
        .put("minus", MINUS)
        .put("negative", NEGATIVE)
        .put("mul", MUL)
        .put("slash", SLASH)
        .put("div", DIV)
        .put("mod", MOD)
        .put("exp", EXP)
        .put("times", TIMES)
        .put("in", SET_IN)
        .put(NodeKinds.SET_IN, SET_IN)
        .put("notin", NOT_IN)
        .put("subseteq", SUBSETEQ)
        .put("cup", CUP)
        .put("cap", CAP)
        .put("setminus", SETMINUS)
        .put("circ", CIRC)
        .put("dots_2", DOTS_2)
        .put("map_to", MAP_TO)
        .put("compose", COMPOSE)
        .put("all_map_to", ALL_MAP_TO)
        .put("maps_to", MAPS_TO)
        .put(NodeKinds.CASE_ARROW, CASE_ARROW)
        .put(NodeKinds.CASE_BOX, CASE_BOX)
        .put(NodeKinds.DEF_EQ, DEF_EQ)
        .put("<-", GETS)
        .put("forall", FORALL)
        .put("exists", EXISTS)
        .put("temporal_forall", TEMPORAL_FORALL)
        .put("temporal_exists", TEMPORAL_EXISTS)
        .put("always", ALWAYS)
        .put("eventually", EVENTUALLY)
        .put("prime", PRIME)
        .put("WF_", WF)
        .put("SF_", SF)
        // punctuation
        .put(NodeKinds.PREV_FUNC_VAL, AT)
        .put("!", BANG)
        .put(":", COLON)
        .put(",", COMMA)
        .put(".", DOT)
        .put("(", PAREN_OPEN)
        .put(")", PAREN_CLOSE)
        .put("[", SQUARE_OPEN)
        .put("]", SQUARE_CLOSE)
        .put("{", CURLY_OPEN)
        .put("}", CURLY_CLOSE)
        .put("langle_bracket", ANGLE_OPEN)
        .put("rangle_bracket", ANGLE_CLOSE)
        .put("rangle_bracket_sub", ANGLE_CLOSE_STEP)
        .build();

    /**
     * Keywords rendered one level left of the declaration
     * they introduce.
     */
    private static final Set<Symbol> DEDENT = ImmutableSet.of(
        EXCEPT, VARIABLE, VARIABLES, CONSTANT, CONSTANTS, EXTENDS
    );

    private static final Set<Symbol> OPENING = ImmutableSet.of(
        PAREN_OPEN, SQUARE_OPEN, CURLY_OPEN, ANGLE_OPEN
    );

    private static final Set<Symbol> CLOSING = ImmutableSet.of(
        PAREN_CLOSE, SQUARE_CLOSE, CURLY_CLOSE, ANGLE_CLOSE, ANGLE_CLOSE_STEP
    );

    /**
     * Nodes that indent their children, unless an enclosing node of
     * this set starting on the same line already did.
     */
    private static final Set<String> MAY_INDENT = ImmutableSet.of(
        NodeKinds.DISJ_ITEM,
        NodeKinds.CONJ_ITEM,
        NodeKinds.LET_IN,
        NodeKinds.BOUND_INFIX_OP,
        NodeKinds.BOUND_OP,
        NodeKinds.EXCEPT,
        NodeKinds.EXTENDS,
        NodeKinds.CHOOSE,
        NodeKinds.RECORD_LITERAL,
        NodeKinds.CONSTANT_DECLARATION,
        NodeKinds.VARIABLE_DECLARATION,
        NodeKinds.BOUNDED_QUANTIFICATION,
        NodeKinds.UNBOUNDED_QUANTIFICATION,
        NodeKinds.QUANTIFIER_BOUND,
        NodeKinds.FUNCTION_DEFINITION,
        NodeKinds.FUNCTION_LITERAL,
        NodeKinds.IF_THEN_ELSE,
        NodeKinds.FINITE_SET_LITERAL,
        NodeKinds.OPERATOR_DEFINITION,
        NodeKinds.SET_OF_FUNCTIONS,
        NodeKinds.SET_OF_RECORDS,
        NodeKinds.SET_MAP
    );

    private static final Set<String> NEVER_INDENT = ImmutableSet.of(
        NodeKinds.SOURCE_FILE,
        NodeKinds.CASE_ARM,
        NodeKinds.OTHER_ARM,
        NodeKinds.FUNCTION_EVALUATION,
        NodeKinds.EXCEPT_UPDATE_RECORD_FIELD,
        NodeKinds.EXCEPT_UPDATE_SPECIFIER,
        NodeKinds.EXCEPT_UPDATE_FN_APPL,
        NodeKinds.EXCEPT_UPDATE,
        NodeKinds.RECORD_VALUE,
        NodeKinds.BOOLEAN,
        NodeKinds.FAIRNESS,
        NodeKinds.BOUND_POSTFIX_OP,
        NodeKinds.BOUND_PREFIX_OP,
        NodeKinds.TUPLE_LITERAL,
        NodeKinds.TUPLE_OF_IDENTIFIERS,
        NodeKinds.PARENTHESES,
        NodeKinds.LOCAL_DEFINITION,
        NodeKinds.SET_FILTER,
        NodeKinds.INSTANCE,
        NodeKinds.THEOREM,
        NodeKinds.ASSUMPTION,
        NodeKinds.MODULE_DEFINITION,
        NodeKinds.OPERATOR_DECLARATION,
        NodeKinds.RECURSIVE_DECLARATION,
        NodeKinds.SUBSTITUTION,
        NodeKinds.LAMBDA,
        NodeKinds.STEP_EXPR_NO_STUTTER
    );

    private final FormattingOptions options;

    private final Renderer renderer;

    private EmptyLines emptyLines;

    public Formatter(FormattingOptions options) {
        this.options = options;
        this.renderer = new Renderer(options);
    }

    /**
     * Format a syntax tree.
     *
     * @param root
     * @param endWithNewline
     * @param out
     */
    public void format(SyntaxNode root, boolean endWithNewline, Writer out) throws StructuralException, IOException {
        emptyLines = new EmptyLines(root.startPosition().row());
        formatNode(root);
        if( endWithNewline && !renderer.getBuffer().isEmpty() )
            renderer.push(Token.SOURCE_NEWLINE);
        renderer.flush(out);
    }

    private void formatNode(SyntaxNode node) throws StructuralException {
        emptyLines.maybeInsert(node, renderer);

        var kind = node.kind();
        var symbol = SYMBOLS.get(kind);
        if( symbol != null ) {
            pushSymbol(symbol);
            return;
        }

        switch( kind ) {
            case NodeKinds.IDENTIFIER, NodeKinds.IDENTIFIER_REF, NodeKinds.PLACEHOLDER -> {
                var name = node.text().strip();
                if( !name.isEmpty() )
                    renderer.push(new Token.Ident(name));
                return;
            }
            case NodeKinds.NAT_NUMBER, NodeKinds.REAL_NUMBER, NodeKinds.STRING, NodeKinds.OPERATOR -> {
                renderer.push(new Token.Lit(node.text()));
                return;
            }
            case NodeKinds.SINGLE_LINE -> {
                renderer.push(new Token.LineDivider('-', options.lineWidth()));
                return;
            }
            case NodeKinds.DOUBLE_LINE -> {
                renderer.push(new Token.LineDivider('=', options.lineWidth()));
                return;
            }
            case NodeKinds.MODULE -> {
                formatModule(node);
                return;
            }
            case NodeKinds.COMMENT, NodeKinds.BLOCK_COMMENT, NodeKinds.EXTRAMODULAR_TEXT -> {
                formatComment(node);
                return;
            }
            case NodeKinds.CASE -> {
                formatCase(node);
                return;
            }
            case NodeKinds.STEP_EXPR_OR_STUTTER -> {
                formatStep(node);
                return;
            }
            case NodeKinds.CONJ_ITEM, NodeKinds.DISJ_ITEM -> {
                formatListItem(node);
                return;
            }
            case NodeKinds.ERROR -> {
                if( options.reportDiagnostics() )
                    log.warn("Syntax error at {} => '{}'", node.startPosition(), node.text());
                renderer.push(new Token.Raw(node.text()));
                return;
            }
            default -> {}
        }

        final boolean skipIndent;
        if( NodeKinds.CONJ_LIST.equals(kind) || NodeKinds.DISJ_LIST.equals(kind) || NodeKinds.LET_IN.equals(kind) ) {
            skipIndent = false;
        }
        else if( NodeKinds.OPERATOR_DEFINITION.equals(kind) && isTopLevel(node) ) {
            skipIndent = true;
        }
        else if( MAY_INDENT.contains(kind) ) {
            skipIndent = isIndentedOnSameLine(node);
        }
        else if( NEVER_INDENT.contains(kind) ) {
            skipIndent = true;
        }
        else {
            if( options.reportDiagnostics() )
                log.warn("Unformatted node {} at {} => '{}'", kind, node.startPosition(), node.text());
            renderer.push(new Token.Raw(node.text()));
            return;
        }

        var indent = renderer.getIndent();
        for( var child : node.children() ) {
            emptyLines.maybeInsert(child, renderer);
            if( !skipIndent )
                renderer.indentInc();
            formatNode(child);
            if( !skipIndent )
                renderer.indentDec();
        }
        assert indent.equals(renderer.getIndent()) : "unbalanced indentation in " + kind;
    }

    private void pushSymbol(Symbol symbol) {
        if( DEDENT.contains(symbol) && renderer.getIndent().depth() > 0 ) {
            renderer.indentDec();
            renderer.push(symbol);
            renderer.indentInc();
        }
        else if( OPENING.contains(symbol) ) {
            renderer.push(symbol);
            renderer.indentInc();
        }
        else if( CLOSING.contains(symbol) ) {
            renderer.indentDec();
            renderer.push(symbol);
        }
        else {
            renderer.push(symbol);
        }
    }

    private static boolean isTopLevel(SyntaxNode node) {
        var parent = node.parent();
        return parent != null && (NodeKinds.MODULE.equals(parent.kind()) || NodeKinds.LOCAL_DEFINITION.equals(parent.kind()));
    }

    /**
     * Check whether an enclosing node that starts on the same line
     * as the given node already indents its children.
     *
     * @param node
     */
    private static boolean isIndentedOnSameLine(SyntaxNode node) {
        var row = node.startPosition().row();
        for( var p = node.parent(); p != null; p = p.parent() ) {
            if( p.startPosition().row() != row )
                return false;
            if( MAY_INDENT.contains(p.kind()) )
                return true;
        }
        return false;
    }

    private void formatModule(SyntaxNode node) throws StructuralException {
        PeekingIterator<SyntaxNode> iter = Iterators.peekingIterator(node.children().iterator());
        while( iter.hasNext() ) {
            var next = iter.peek();
            emptyLines.maybeInsert(next, renderer);
            if( NodeKinds.HEADER_LINE.equals(next.kind()) )
                formatModuleHeader(iter);
            else
                formatNode(iter.next());
        }
    }

    /**
     * Consume the nodes of a module header, i.e. the dashes, the
     * {@code MODULE} keyword, the module name and the dashes.
     *
     * @param iter
     */
    private void formatModuleHeader(PeekingIterator<SyntaxNode> iter) throws ModuleHeaderException {
        var left = iter.next();
        if( iter.hasNext() && !iter.peek().isNamed() && "MODULE".equals(iter.peek().kind()) )
            iter.next();
        if( !iter.hasNext() || !NodeKinds.IDENTIFIER.equals(iter.peek().kind()) )
            throw new ModuleHeaderException("Module header is missing the module name", left.startPosition());
        var name = iter.next();
        if( !iter.hasNext() || !NodeKinds.HEADER_LINE.equals(iter.peek().kind()) )
            throw new ModuleHeaderException("Module header is not terminated", name.endPosition());
        emptyLines.suppress(iter.next());
        renderer.push(new Token.ModuleHeader(name.text().strip(), options.lineWidth()));
    }

    private void formatComment(SyntaxNode node) {
        var token = new Token.Comment(node.text(), new Position.Source(node.startPosition().row(), node.startPosition().column()));
        var indent = renderer.getIndent();
        if( node.startPosition().column() == 0 ) {
            renderer.setIndent(Indent.ZERO);
        }
        else if( node.parent() != null && NodeKinds.OPERATOR_DEFINITION.equals(node.parent().kind()) ) {
            // first line of an operator body
            renderer.setIndent(Indent.max(new Indent(1), indent));
        }
        renderer.push(token);
        renderer.setIndent(indent);
    }

    /**
     * Format a case expression. Each box starts a new line and
     * the arms are indented one level beyond the keyword.
     *
     * @param node
     */
    private void formatCase(SyntaxNode node) throws StructuralException {
        var iter = Iterators.peekingIterator(node.namedChildren().iterator());
        renderer.indentInc();
        renderer.push(CASE);

        var inCondition = true;
        while( iter.hasNext() ) {
            var child = iter.next();
            switch( child.kind() ) {
                case NodeKinds.CASE_BOX -> {
                    renderer.push(Token.NEWLINE);
                    renderer.push(CASE_BOX);
                }
                case NodeKinds.CASE_ARM, NodeKinds.OTHER_ARM -> {
                    emptyLines.suppress(child);
                    if( iter.hasNext() && NodeKinds.CASE_BOX.equals(iter.peek().kind()) )
                        emptyLines.suppress(iter.peek());

                    renderer.indentInc();
                    formatNode(child);
                    renderer.indentDec();

                    if( inCondition ) {
                        renderer.indentInc();
                        inCondition = false;
                    }
                }
                default -> formatNode(child);
            }
        }

        // once for the keyword, once for the arms
        if( !inCondition )
            renderer.indentDec();
        renderer.indentDec();
    }

    /**
     * Format a step expression such as {@code [Next]_vars}. The
     * action is kept as written.
     *
     * @param node
     */
    private void formatStep(SyntaxNode node) throws StructuralException {
        SyntaxNode action = null;
        SyntaxNode subscript = null;
        var comments = new ArrayList<SyntaxNode>();
        // the action sits inside the brackets, the subscript after them
        var afterBrackets = false;
        for( var child : node.children() ) {
            if( "]_".equals(child.kind()) )
                afterBrackets = true;
            else if( !child.isNamed() )
                continue;
            else if( isComment(child) )
                comments.add(child);
            else if( !afterBrackets )
                action = child;
            else if( subscript == null )
                subscript = child;
        }
        if( action == null )
            throw new StepOrStutterException("Step expression is missing its action", node.startPosition());
        if( subscript == null )
            throw new StepOrStutterException("Step expression is missing its subscript", node.endPosition());

        renderer.push(new Token.StepOrStutter(action.text()));
        for( var comment : comments )
            formatNode(comment);
        emptyLines.suppress(subscript);
        formatNode(subscript);
    }

    /**
     * Format a conjunction or disjunction item on a new line, with
     * the body indented from the bullet.
     *
     * @param node
     */
    private void formatListItem(SyntaxNode node) throws StructuralException {
        renderer.push(Token.NEWLINE);

        var bulleted = false;
        for( var child : node.namedChildren() ) {
            switch( child.kind() ) {
                case NodeKinds.BULLET_CONJ -> {
                    renderer.push(AND);
                    renderer.indentInc();
                    bulleted = true;
                }
                case NodeKinds.BULLET_DISJ -> {
                    renderer.push(OR);
                    renderer.indentInc();
                    bulleted = true;
                }
                default -> formatNode(child);
            }
        }

        if( bulleted )
            renderer.indentDec();
    }

    private static boolean isComment(SyntaxNode node) {
        return NodeKinds.COMMENT.equals(node.kind()) || NodeKinds.BLOCK_COMMENT.equals(node.kind());
    }
}
