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
import java.util.Collections;
import java.util.List;

import com.google.common.base.Strings;

/**
 * Collects the output tokens of a document together with their
 * indentation, then runs the comment alignment and indentation
 * limiting passes and writes the text.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class Renderer {

    public record Entry(Token token, Indent indent) {

        public Entry withToken(Token token) {
            return new Entry(token, indent);
        }

        public Entry withIndent(Indent indent) {
            return new Entry(token, indent);
        }
    }

    private final FormattingOptions options;

    private final List<Entry> buffer = new ArrayList<>();

    private Indent indent = Indent.ZERO;

    private boolean lineCommentOpen;

    public Renderer(FormattingOptions options) {
        this.options = options;
    }

    /**
     * Append a token at the current indentation. A line comment
     * always ends its line.
     *
     * @param token
     */
    public void push(Token token) {
        if( lineCommentOpen && !token.isNewline() )
            buffer.add(new Entry(Token.NEWLINE, indent));
        lineCommentOpen = token instanceof Token.Comment comment && comment.isLineComment();
        buffer.add(new Entry(token, indent));
    }

    public Indent getIndent() {
        return indent;
    }

    public void setIndent(Indent indent) {
        this.indent = indent;
    }

    public void indentInc() {
        indent = indent.inc();
    }

    public void indentDec() {
        indent = indent.dec();
    }

    public List<Entry> getBuffer() {
        return Collections.unmodifiableList(buffer);
    }

    /**
     * Run the buffer passes and write the buffered tokens.
     *
     * Comments are aligned before indentation is limited.
     *
     * @param out
     */
    public void flush(Writer out) throws IOException {
        CommentAligner.align(buffer, options);
        IndentLimiter.limit(buffer);
        write(buffer, options, out);
        buffer.clear();
    }

    /**
     * Write a token buffer as text.
     *
     * @param buffer
     * @param options
     * @param out
     */
    public static void write(List<Entry> buffer, FormattingOptions options, Writer out) throws IOException {
        var writer = new IndentWriter(out, options.indentSize());
        Token last = null;
        for( int i = 0; i < buffer.size(); i++ ) {
            var entry = buffer.get(i);
            var token = entry.token();
            if( i + 1 < buffer.size() && !Spacing.canPrecede(token, buffer.get(i + 1).token()) )
                continue;
            if( token instanceof Token.Newline && (last == null || last.isNewline()) )
                continue;

            writer.setDepth(entry.indent().depth());
            if( last != null )
                writer.write(Strings.repeat(" ", Spacing.delimitingSpaceLen(last, token)));
            else if( token instanceof Token.Comment comment && comment.position() instanceof Position.Relative relative )
                writer.write(Strings.repeat(" ", relative.padding()));

            if( token instanceof Token.Comment || token instanceof Token.StepOrStutter )
                writeVerbatim(writer, token.text());
            else
                writeToken(writer, token);
            last = token;
        }
        writer.flush();
    }

    private static void writeToken(IndentWriter writer, Token token) throws IOException {
        var text = token.text();
        assert token instanceof Token.Raw || token.isNewline() || text.length() == token.width() : "width mismatch for " + token;
        writer.write(text);
    }

    /**
     * Write multi-line text with only the first line indented.
     */
    private static void writeVerbatim(IndentWriter writer, String text) throws IOException {
        var lines = text.split("\n", -1);
        writer.write(lines[0]);
        if( lines.length == 1 )
            return;
        writer.setDepth(0);
        for( int i = 1; i < lines.length; i++ )
            writer.write("\n" + lines[i]);
    }
}
