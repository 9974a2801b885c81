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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.InputMismatchException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tlafmt.ast.NodeKinds;
import tlafmt.ast.SourcePosition;
import tlafmt.ast.SourceText;
import tlafmt.ast.SyntaxNode;
import tlafmt.ast.TreeNode;
import tlafmt.exception.ParseException;

import static tlafmt.parser.TlaParser.*;

/**
 * Transform a TLA+ parse tree into a syntax tree.
 *
 * The syntax tree keeps every token, including comments, so that
 * the formatter can reproduce the document. A comment is attached
 * to the parent of the outermost node that starts after it.
 *
 * The module is parsed one unit at a time. A unit that cannot be
 * parsed is kept verbatim as an error node, up to the next line
 * that starts at column 0.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class TlaAstBuilder {

    private static final Logger log = LoggerFactory.getLogger(TlaAstBuilder.class);

    // formatting adds at most three indent levels per tree level
    private static final int MAX_DEPTH = 80;

    private static final Map<Class<? extends ParserRuleContext>, String> NODE_KINDS = ImmutableMap.<Class<? extends ParserRuleContext>, String>builder()
        // units
        .put(ExtendsUnitContext.class, NodeKinds.EXTENDS)
        .put(ConstantDeclarationContext.class, NodeKinds.CONSTANT_DECLARATION)
        .put(VariableDeclarationContext.class, NodeKinds.VARIABLE_DECLARATION)
        .put(RecursiveDeclarationContext.class, NodeKinds.RECURSIVE_DECLARATION)
        .put(OperatorDeclarationContext.class, NodeKinds.OPERATOR_DECLARATION)
        .put(LocalDefinitionContext.class, NodeKinds.LOCAL_DEFINITION)
        .put(InstanceContext.class, NodeKinds.INSTANCE)
        .put(SubstitutionContext.class, NodeKinds.SUBSTITUTION)
        .put(TheoremContext.class, NodeKinds.THEOREM)
        .put(AssumptionContext.class, NodeKinds.ASSUMPTION)
        .put(ModuleDefinitionAltContext.class, NodeKinds.MODULE_DEFINITION)
        .put(OperatorDefinitionAltContext.class, NodeKinds.OPERATOR_DEFINITION)
        .put(FunctionDefinitionAltContext.class, NodeKinds.FUNCTION_DEFINITION)
        // operators
        .put(PostfixExprAltContext.class, NodeKinds.BOUND_POSTFIX_OP)
        .put(FunctionEvaluationExprAltContext.class, NodeKinds.FUNCTION_EVALUATION)
        .put(RecordValueExprAltContext.class, NodeKinds.RECORD_VALUE)
        .put(ExponentExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(MultiplicativeExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(SubtractiveExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(AdditiveExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(RangeExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(SetExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(MapToExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(ComposeExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(RelationalExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(JunctionExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(EquivalenceExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(ImpliesExprAltContext.class, NodeKinds.BOUND_INFIX_OP)
        .put(NegativeExprAltContext.class, NodeKinds.BOUND_PREFIX_OP)
        .put(DomainExprAltContext.class, NodeKinds.BOUND_PREFIX_OP)
        .put(PowersetExprAltContext.class, NodeKinds.BOUND_PREFIX_OP)
        .put(LogicalPrefixExprAltContext.class, NodeKinds.BOUND_PREFIX_OP)
        // primaries
        .put(FairnessContext.class, NodeKinds.FAIRNESS)
        .put(BooleanPrmrAltContext.class, NodeKinds.BOOLEAN)
        .put(ParenthesesContext.class, NodeKinds.PARENTHESES)
        .put(ChoosePrmrAltContext.class, NodeKinds.CHOOSE)
        .put(IfThenElsePrmrAltContext.class, NodeKinds.IF_THEN_ELSE)
        .put(CasePrmrAltContext.class, NodeKinds.CASE)
        .put(CaseArmAltContext.class, NodeKinds.CASE_ARM)
        .put(OtherArmAltContext.class, NodeKinds.OTHER_ARM)
        .put(LetInPrmrAltContext.class, NodeKinds.LET_IN)
        .put(LambdaPrmrAltContext.class, NodeKinds.LAMBDA)
        .put(EmptyTupleAltContext.class, NodeKinds.TUPLE_LITERAL)
        .put(TupleLiteralAltContext.class, NodeKinds.TUPLE_LITERAL)
        .put(StepNoStutterAltContext.class, NodeKinds.STEP_EXPR_NO_STUTTER)
        .put(EmptySetAltContext.class, NodeKinds.FINITE_SET_LITERAL)
        .put(FiniteSetAltContext.class, NodeKinds.FINITE_SET_LITERAL)
        .put(SetFilterAltContext.class, NodeKinds.SET_FILTER)
        .put(SetMapAltContext.class, NodeKinds.SET_MAP)
        .put(RecordLiteralAltContext.class, NodeKinds.RECORD_LITERAL)
        .put(SetOfRecordsAltContext.class, NodeKinds.SET_OF_RECORDS)
        .put(FunctionLiteralAltContext.class, NodeKinds.FUNCTION_LITERAL)
        .put(SetOfFunctionsAltContext.class, NodeKinds.SET_OF_FUNCTIONS)
        .put(ExceptAltContext.class, NodeKinds.EXCEPT)
        .put(StepOrStutterAltContext.class, NodeKinds.STEP_EXPR_OR_STUTTER)
        .put(ExceptUpdateContext.class, NodeKinds.EXCEPT_UPDATE)
        .put(ExceptSpecifierContext.class, NodeKinds.EXCEPT_UPDATE_SPECIFIER)
        .put(ExceptRecordFieldAltContext.class, NodeKinds.EXCEPT_UPDATE_RECORD_FIELD)
        .put(ExceptFnApplAltContext.class, NodeKinds.EXCEPT_UPDATE_FN_APPL)
        .put(BoundedQuantificationAltContext.class, NodeKinds.BOUNDED_QUANTIFICATION)
        .put(UnboundedQuantificationAltContext.class, NodeKinds.UNBOUNDED_QUANTIFICATION)
        .put(QuantifierBoundContext.class, NodeKinds.QUANTIFIER_BOUND)
        .put(TupleOfIdentifiersContext.class, NodeKinds.TUPLE_OF_IDENTIFIERS)
        // bullet lists
        .put(ConjListContext.class, NodeKinds.CONJ_LIST)
        .put(ConjItemContext.class, NodeKinds.CONJ_ITEM)
        .put(DisjListContext.class, NodeKinds.DISJ_LIST)
        .put(DisjItemContext.class, NodeKinds.DISJ_ITEM)
        .build();

    private static final Map<Integer, String> OPERATOR_KINDS = ImmutableMap.<Integer, String>builder()
        .put(IMPLIES, "implies")
        .put(EQUIV, "equiv")
        .put(EQUIV_WORD, "equiv")
        .put(LEADS_TO, "leads_to")
        .put(LAND_WORD, "land")
        .put(LOR_WORD, "lor")
        .put(NEQ, "neq")
        .put(HASH, "neq")
        .put(LT, "lt")
        .put(GT, "gt")
        .put(LEQ, "leq")
        .put(LEQ_ALT, "leq")
        .put(LEQ_WORD, "leq")
        .put(GEQ, "geq")
        .put(GEQ_WORD, "geq")
        .put(ASSIGN, NodeKinds.OPERATOR)
        .put(NOTIN, "notin")
        .put(SUBSETEQ, "subseteq")
        .put(RELATION_WORD, NodeKinds.OPERATOR)
        .put(COMPOSE, "compose")
        .put(MAP_TO, "map_to")
        .put(SETMINUS, "setminus")
        .put(CUP, "cup")
        .put(CAP, "cap")
        .put(DOTS_2, "dots_2")
        .put(PLUS, "plus")
        .put(PLUS_PLUS, NodeKinds.OPERATOR)
        .put(PIPE, NodeKinds.OPERATOR)
        .put(PERCENT, "mod")
        .put(TIMES, "times")
        .put(STAR, "mul")
        .put(SLASH, "slash")
        .put(AMP, NodeKinds.OPERATOR)
        .put(CIRC, "circ")
        .put(DIV, "div")
        .put(PRODUCT_WORD, NodeKinds.OPERATOR)
        .put(CARET, "exp")
        .put(PRIME, "prime")
        .put(CARET_PLUS, NodeKinds.OPERATOR)
        .put(CARET_STAR, NodeKinds.OPERATOR)
        .put(CARET_HASH, NodeKinds.OPERATOR)
        .put(TILDE, "lnot")
        .put(LNOT_WORD, "lnot")
        .put(DIAMOND, "eventually")
        .put(FORALL, "forall")
        .put(EXISTS, "exists")
        .put(TEMPORAL_FORALL, "temporal_forall")
        .put(TEMPORAL_EXISTS, "temporal_exists")
        .put(DEF_EQ, NodeKinds.DEF_EQ)
        .put(LANGLE, "langle_bracket")
        .put(RANGLE, "rangle_bracket")
        .put(RANGLE_SUB, "rangle_bracket_sub")
        .put(ALL_MAP_TO, "all_map_to")
        .put(UNDERSCORE, NodeKinds.PLACEHOLDER)
        .put(NUMBER, NodeKinds.NAT_NUMBER)
        .put(REAL, NodeKinds.REAL_NUMBER)
        .put(STRING, NodeKinds.STRING)
        .put(NAT, "nat_number_set")
        .put(INT, "int_number_set")
        .put(REAL_SET, "real_number_set")
        .put(BOOLEAN, "boolean_set")
        .put(STRING_SET, "string_set")
        .put(AT, NodeKinds.PREV_FUNC_VAL)
        .build();

    private static final Set<String> NAMED_LEAVES = ImmutableSet.of(
        NodeKinds.HEADER_LINE, NodeKinds.SINGLE_LINE, NodeKinds.DOUBLE_LINE,
        NodeKinds.IDENTIFIER, NodeKinds.IDENTIFIER_REF, NodeKinds.PLACEHOLDER,
        NodeKinds.NAT_NUMBER, NodeKinds.REAL_NUMBER, NodeKinds.STRING, NodeKinds.PREV_FUNC_VAL,
        "nat_number_set", "int_number_set", "real_number_set", "boolean_set", "string_set",
        NodeKinds.CASE_BOX, NodeKinds.BULLET_CONJ, NodeKinds.BULLET_DISJ
    );

    private static final Set<Class<? extends ParserRuleContext>> IDENTIFIER_REF_PARENTS = ImmutableSet.of(
        ExtendsUnitContext.class,
        InstanceContext.class,
        SubstitutionContext.class,
        RecordValueExprAltContext.class,
        ExceptRecordFieldAltContext.class
    );

    private static final ANTLRErrorListener ERROR_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e) {
            log.debug("Syntax error at {}:{}: {}", line, charPositionInLine + 1, msg);
        }
    };

    private final SourceText source;

    private final CommonTokenStream tokenStream;

    private final TlaParser parser;

    /** Index of the first token, comments included, not yet in the tree. */
    private int cursor;

    public TlaAstBuilder(String text) {
        this.source = new SourceText(text);
        var lexer = new TlaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        this.tokenStream = new CommonTokenStream(lexer);
        tokenStream.fill();
        this.parser = new TlaParser(tokenStream);
        parser.setErrorHandler(new UnitErrorStrategy());
    }

    public SourceText getSource() {
        return source;
    }

    /**
     * Build the syntax tree, rooted at a {@code source_file} node.
     *
     * Syntax errors are recorded in the tree as error nodes.
     */
    public TreeNode buildAST() throws ParseException {
        TreeNode root;
        try {
            root = sourceFile();
        }
        catch( StackOverflowError e ) {
            throw new ParseException("Expression nesting is too deep to parse");
        }

        var tooDeep = nodeAtDepth(root, MAX_DEPTH + 1);
        if( tooDeep != null )
            throw new ParseException("Expression nesting exceeds " + MAX_DEPTH + " levels at " + tooDeep.startPosition());
        return root;
    }

    private static SyntaxNode nodeAtDepth(SyntaxNode node, int depth) {
        if( depth == 0 )
            return node;
        for( var child : node.children() ) {
            var result = nodeAtDepth(child, depth - 1);
            if( result != null )
                return result;
        }
        return null;
    }

    private TreeNode sourceFile() {
        var children = new ArrayList<TreeNode>();
        var eof = tokenStream.size() - 1;
        var header = findModuleHeader();
        if( header < 0 ) {
            if( eof > 0 )
                children.add(region(NodeKinds.ERROR, 0, eof));
            return TreeNode.root(source, NodeKinds.SOURCE_FILE, children);
        }

        if( header > 0 )
            children.add(region(NodeKinds.EXTRAMODULAR_TEXT, 0, header));

        cursor = header;
        tokenStream.seek(header);
        children.add(module());

        if( cursor < eof )
            children.add(region(NodeKinds.EXTRAMODULAR_TEXT, cursor, eof));

        return TreeNode.root(source, NodeKinds.SOURCE_FILE, children);
    }

    private int findModuleHeader() {
        Token previous = null;
        for( var token : tokenStream.getTokens() ) {
            if( token.getChannel() != Token.DEFAULT_CHANNEL )
                continue;
            if( previous != null && previous.getType() == DASHES && token.getType() == MODULE )
                return previous.getTokenIndex();
            previous = token;
        }
        return -1;
    }

    private TreeNode module() {
        var children = new ArrayList<TreeNode>();
        visit(parse(TlaParser::moduleHeader), children);

        while( true ) {
            var next = tokenStream.LT(1);
            flushComments(children, next.getTokenIndex());
            if( next.getType() == Token.EOF )
                break;
            if( next.getType() == DOUBLE_LINE ) {
                addLeaf(children, next, NodeKinds.DOUBLE_LINE);
                tokenStream.consume();
                break;
            }
            children.add(unitOrError());
        }
        return TreeNode.node(source, NodeKinds.MODULE, children);
    }

    private TreeNode unitOrError() {
        var start = tokenStream.index();
        UnitContext ctx;
        try {
            ctx = parse(TlaParser::unit);
        }
        catch( ParseCancellationException e ) {
            return errorRegion(start);
        }
        var children = new ArrayList<TreeNode>();
        visit(ctx, children);
        return Iterables.getOnlyElement(children);
    }

    /**
     * Parse a rule starting at the current token, first with the
     * faster SLL prediction and then, if that fails, with full LL.
     *
     * @param rule
     */
    private <T extends ParserRuleContext> T parse(Function<TlaParser, T> rule) {
        var start = tokenStream.index();
        try {
            return parse(rule, start, PredictionMode.SLL);
        }
        catch( ParseCancellationException e ) {
            return parse(rule, start, PredictionMode.LL);
        }
    }

    private <T extends ParserRuleContext> T parse(Function<TlaParser, T> rule, int start, PredictionMode predictionMode) {
        parser.reset();
        tokenStream.seek(start);
        parser.getInterpreter().setPredictionMode(predictionMode);

        parser.removeErrorListeners();
        if( predictionMode == PredictionMode.LL )
            parser.addErrorListener(ERROR_LISTENER);

        return rule.apply(parser);
    }

    /**
     * Consume the tokens of a unit that failed to parse, up to the
     * next line starting at column 0 or the end of the module.
     *
     * @param start
     */
    private TreeNode errorRegion(int start) {
        var line = tokenStream.get(start).getLine();
        var end = start + 1;
        while( true ) {
            var token = tokenStream.get(end);
            if( token.getType() == Token.EOF || token.getType() == DOUBLE_LINE )
                break;
            if( token.getLine() > line && token.getCharPositionInLine() == 0 )
                break;
            end++;
        }
        var result = region(NodeKinds.ERROR, start, end);
        cursor = end;
        tokenStream.seek(end);
        return result;
    }

    private TreeNode region(String kind, int from, int to) {
        var first = tokenStream.get(from);
        var last = tokenStream.get(to - 1);
        return TreeNode.leaf(source, kind, true, first.getStartIndex(), last.getStopIndex() + 1, startPosition(first), endPosition(last));
    }

    /// parse tree to syntax tree

    private void visit(ParseTree tree, List<TreeNode> children) {
        if( tree instanceof TerminalNode terminal ) {
            terminal(terminal.getSymbol(), (ParserRuleContext) terminal.getParent(), children);
            return;
        }

        var ctx = (ParserRuleContext) tree;
        if( ctx instanceof IdentifierRefContext ) {
            identifierRef(ctx, children);
            return;
        }

        var kind = nodeKind(ctx);
        if( kind == null ) {
            visitChildren(ctx, children);
            return;
        }

        flushComments(children, ctx.getStart().getTokenIndex());
        var nodeChildren = new ArrayList<TreeNode>();
        visitChildren(ctx, nodeChildren);
        if( ctx instanceof ConjListContext || ctx instanceof DisjListContext )
            flushTrailingComments(nodeChildren, ctx.getStart().getCharPositionInLine());
        children.add(TreeNode.node(source, kind, nodeChildren));
    }

    private void visitChildren(ParserRuleContext ctx, List<TreeNode> children) {
        if( ctx.children == null )
            return;
        for( var child : ctx.children )
            visit(child, children);
    }

    /**
     * Get the node kind of a parse tree context, or null if the
     * children of the context belong to the enclosing node.
     *
     * @param ctx
     */
    private static String nodeKind(ParserRuleContext ctx) {
        if( ctx instanceof IdentifierPrmrAltContext call )
            return call.LPAREN() != null ? NodeKinds.BOUND_OP : null;
        return NODE_KINDS.get(ctx.getClass());
    }

    private void terminal(Token token, ParserRuleContext parent, List<TreeNode> children) {
        if( parent instanceof FairnessContext && token.getType() == IDENTIFIER ) {
            fairnessPrefix(token, children);
            return;
        }
        addLeaf(children, token, leafKind(token, parent));
    }

    private static String leafKind(Token token, ParserRuleContext parent) {
        if( parent instanceof InfixSymbolContext )
            return NodeKinds.OPERATOR;

        return switch( token.getType() ) {
            case DASHES -> parent instanceof SingleLineContext ? NodeKinds.SINGLE_LINE : NodeKinds.HEADER_LINE;
            case IDENTIFIER -> IDENTIFIER_REF_PARENTS.contains(parent.getClass()) ? NodeKinds.IDENTIFIER_REF : NodeKinds.IDENTIFIER;
            case ARROW -> parent instanceof SetOfFunctionsAltContext ? "maps_to" : NodeKinds.CASE_ARROW;
            case BOX -> parent instanceof CasePrmrAltContext ? NodeKinds.CASE_BOX : "always";
            case LAND -> parent instanceof ConjItemContext ? NodeKinds.BULLET_CONJ : "land";
            case LOR -> parent instanceof DisjItemContext ? NodeKinds.BULLET_DISJ : "lor";
            case SET_IN -> parent instanceof RelationalExprAltContext ? "in" : NodeKinds.SET_IN;
            case EQ -> parent instanceof ExceptUpdateContext ? "=" : "eq";
            case MINUS -> parent instanceof NegativeExprAltContext ? "negative" : "minus";
            default -> OPERATOR_KINDS.getOrDefault(token.getType(), token.getText());
        };
    }

    /**
     * Add an identifier reference, joining module instance
     * prefixes such as {@code M!Op} into a single leaf.
     *
     * @param ctx
     * @param children
     */
    private void identifierRef(ParserRuleContext ctx, List<TreeNode> children) {
        var first = ctx.getStart();
        var last = ctx.getStop();
        flushComments(children, first.getTokenIndex());
        children.add(TreeNode.leaf(source, NodeKinds.IDENTIFIER_REF, true, first.getStartIndex(), last.getStopIndex() + 1, startPosition(first), endPosition(last)));
        cursor = last.getTokenIndex() + 1;
    }

    /**
     * Split a fairness prefix such as {@code WF_vars} into the
     * operator and the subscript.
     *
     * @param token
     * @param children
     */
    private void fairnessPrefix(Token token, List<TreeNode> children) {
        flushComments(children, token.getTokenIndex());
        var start = token.getStartIndex();
        var row = token.getLine() - 1;
        var column = token.getCharPositionInLine();
        var prefix = token.getText().substring(0, 3);
        children.add(TreeNode.leaf(source, prefix, false, start, start + 3, new SourcePosition(row, column), new SourcePosition(row, column + 3)));
        if( token.getText().length() > 3 )
            children.add(TreeNode.leaf(source, NodeKinds.IDENTIFIER_REF, true, start + 3, token.getStopIndex() + 1, new SourcePosition(row, column + 3), endPosition(token)));
        cursor = token.getTokenIndex() + 1;
    }

    private void addLeaf(List<TreeNode> children, Token token, String kind) {
        flushComments(children, token.getTokenIndex());
        children.add(leaf(token, kind));
        cursor = token.getTokenIndex() + 1;
    }

    private TreeNode leaf(Token token, String kind) {
        return TreeNode.leaf(source, kind, NAMED_LEAVES.contains(kind), token.getStartIndex(), token.getStopIndex() + 1, startPosition(token), endPosition(token));
    }

    /**
     * Attach the comments that precede the given token.
     *
     * @param children
     * @param index
     */
    private void flushComments(List<TreeNode> children, int index) {
        while( cursor < index ) {
            var token = tokenStream.get(cursor);
            Preconditions.checkState(token.getChannel() == TlaLexer.COMMENT, "token '%s' was not attached to the tree", token.getText());
            children.add(comment(token));
            cursor++;
        }
    }

    /**
     * Attach the comments that follow the last item of a bullet
     * list, stopping at the first one left of the bullets.
     *
     * @param children
     * @param minColumn
     */
    private void flushTrailingComments(List<TreeNode> children, int minColumn) {
        while( true ) {
            var token = tokenStream.get(cursor);
            if( token.getChannel() != TlaLexer.COMMENT || token.getCharPositionInLine() < minColumn )
                break;
            children.add(comment(token));
            cursor++;
        }
    }

    private TreeNode comment(Token token) {
        var kind = token.getType() == TlaLexer.BLOCK_COMMENT ? NodeKinds.BLOCK_COMMENT : NodeKinds.COMMENT;
        return TreeNode.leaf(source, kind, true, token.getStartIndex(), token.getStopIndex() + 1, startPosition(token), endPosition(token));
    }

    private static SourcePosition startPosition(Token token) {
        return new SourcePosition(token.getLine() - 1, token.getCharPositionInLine());
    }

    private static SourcePosition endPosition(Token token) {
        var text = token.getText();
        var row = token.getLine() - 1;
        var newline = text.lastIndexOf('\n');
        if( newline < 0 )
            return new SourcePosition(row, token.getCharPositionInLine() + text.codePointCount(0, text.length()));
        var lines = (int) text.chars().filter(c -> c == '\n').count();
        return new SourcePosition(row + lines, text.codePointCount(newline + 1, text.length()));
    }

    /**
     * Abandon the parse of a unit at the first syntax error, so
     * that the unit can be kept verbatim.
     */
    private static class UnitErrorStrategy extends BailErrorStrategy {

        @Override
        public Token recoverInline(Parser recognizer) throws RecognitionException {
            reportError(recognizer, new InputMismatchException(recognizer));
            return super.recoverInline(recognizer);
        }
    }
}
