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
package tlafmt.control;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import tlafmt.ast.SyntaxNode;
import tlafmt.exception.ParseException;
import tlafmt.exception.StructuralException;
import tlafmt.formatter.Formatter;
import tlafmt.formatter.FormattingOptions;
import tlafmt.parser.TlaAstBuilder;

/**
 * A parsed TLA+ document, ready to be formatted.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class ParsedDocument {

    private final String text;

    private final SyntaxNode root;

    private ParsedDocument(String text, SyntaxNode root) {
        this.text = text;
        this.root = root;
    }

    /**
     * Parse a document.
     *
     * Malformed definitions do not fail the parse, they are kept
     * as error nodes and passed through verbatim when formatting.
     *
     * @param text
     */
    public static ParsedDocument parse(String text) throws ParseException {
        if( text == null )
            throw new ParseException("No input to parse");
        return new ParsedDocument(text, new TlaAstBuilder(text).buildAST());
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public String getText() {
        return text;
    }

    public void format(Writer out) throws StructuralException, IOException {
        format(out, FormattingOptions.defaults());
    }

    public void format(Writer out, FormattingOptions options) throws StructuralException, IOException {
        new Formatter(options).format(root, text.endsWith("\n"), out);
        out.flush();
    }

    /**
     * Write the formatted document as UTF-8.
     *
     * @param out
     */
    public void format(OutputStream out) throws StructuralException, IOException {
        format(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    public String format() throws StructuralException {
        return format(FormattingOptions.defaults());
    }

    public String format(FormattingOptions options) throws StructuralException {
        var out = new StringWriter();
        try {
            format(out, options);
        }
        catch( IOException e ) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
