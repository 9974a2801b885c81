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

/**
 * Keywords, operators and punctuation with a fixed rendering.
 *
 * Synonyms are rendered with a single canonical spelling,
 * e.g. both the cup and the union spellings render as the union operator.
 */
public enum Symbol implements Token {
    // keywords
    LET("LET"),
    IN("IN"),
    CHOOSE("CHOOSE"),
    LOCAL("LOCAL"),
    IF("IF"),
    THEN("THEN"),
    ELSE("ELSE"),
    CASE("CASE"),
    OTHER("OTHER"),
    INSTANCE("INSTANCE"),
    WITH("WITH"),
    EXTENDS("EXTENDS"),
    CONSTANT("CONSTANT"),
    CONSTANTS("CONSTANTS"),
    VARIABLE("VARIABLE"),
    VARIABLES("VARIABLES"),
    EXCEPT("EXCEPT"),
    THEOREM("THEOREM"),
    LEMMA("LEMMA"),
    PROPOSITION("PROPOSITION"),
    COROLLARY("COROLLARY"),
    ASSUME("ASSUME"),
    ASSUMPTION("ASSUMPTION"),
    AXIOM("AXIOM"),
    RECURSIVE("RECURSIVE"),
    LAMBDA("LAMBDA"),
    UNCHANGED("UNCHANGED"),
    ENABLED("ENABLED"),
    SUBSET("SUBSET"),
    UNION("UNION"),
    DOMAIN("DOMAIN"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    BOOLEAN("BOOLEAN"),
    STRING("STRING"),
    NAT("Nat"),
    INT("Int"),
    REAL("Real"),

    // operators
    IMPLIES("=>"),
    EQUIV("<=>"),
    LEADS_TO("~>"),
    AND("/\\"),
    OR("\\/"),
    NOT("~"),
    EQ("="),
    DEF_EQ("=="),
    NEQ("/="),
    LT("<"),
    GT(">"),
    LEQ("<="),
    GEQ(">="),
    PLUS("+"),
    MINUS("-"),
    NEGATIVE("-"),
    MUL("*"),
    SLASH("/"),
    DIV("\\div"),
    MOD("%"),
    EXP("^"),
    TIMES("\\X"),
    SET_IN("\\in"),
    NOT_IN("\\notin"),
    SUBSETEQ("\\subseteq"),
    CUP("\\union"),
    CAP("\\intersect"),
    SETMINUS("\\"),
    CIRC("\\o"),
    DOTS_2(".."),
    MAP_TO(":>"),
    COMPOSE("@@"),
    ALL_MAP_TO("|->"),
    MAPS_TO("->"),
    CASE_ARROW("->"),
    CASE_BOX("[]"),
    GETS("<-"),
    FORALL("\\A"),
    EXISTS("\\E"),
    TEMPORAL_FORALL("\\AA"),
    TEMPORAL_EXISTS("\\EE"),
    ALWAYS("[]"),
    EVENTUALLY("<>"),
    PRIME("'"),
    WF("WF_"),
    SF("SF_"),

    // punctuation
    AT("@"),
    BANG("!"),
    COLON(":"),
    COMMA(","),
    DOT("."),
    PAREN_OPEN("("),
    PAREN_CLOSE(")"),
    SQUARE_OPEN("["),
    SQUARE_CLOSE("]"),
    CURLY_OPEN("{"),
    CURLY_CLOSE("}"),
    ANGLE_OPEN("<<"),
    ANGLE_CLOSE(">>"),
    ANGLE_CLOSE_STEP(">>_");

    private final String text;

    Symbol(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int width() {
        return text.length();
    }
}
