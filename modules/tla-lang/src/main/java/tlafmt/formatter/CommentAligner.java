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

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps trailing comments that were aligned in the source aligned
 * in the output.
 *
 * A run is a sequence of end-of-line comments on consecutive output
 * lines that started at the same source column. The comments of a run
 * are moved to one column past the longest line of the run, or to their
 * source column when it is further right.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
final class CommentAligner {

    private CommentAligner() {}

    static void align(List<Renderer.Entry> buffer, FormattingOptions options) {
        var run = new ArrayList<Integer>();
        var lines = 0;
        var lastColumn = -1;
        var lastWasNewline = true;
        for( int i = 0; i < buffer.size(); i++ ) {
            var token = buffer.get(i).token();
            if( token.isNewline() ) {
                if( !(token instanceof Token.Newline && lastWasNewline) )
                    lines++;
                lastWasNewline = true;
                continue;
            }
            lastWasNewline = false;

            if( token instanceof Token.Comment comment && comment.position() instanceof Position.Source source ) {
                if( !run.isEmpty() && (lines != 1 || source.column() != lastColumn) ) {
                    realign(buffer, run, options);
                    run.clear();
                }
                var endOfLine = i + 1 < buffer.size() && buffer.get(i + 1).token().isNewline();
                if( endOfLine && !comment.text().contains("\n") ) {
                    run.add(i);
                    lines = 0;
                    lastColumn = source.column();
                    continue;
                }
            }
            lines += countNewlines(token);
        }
        if( !run.isEmpty() )
            realign(buffer, run, options);
    }

    private static void realign(List<Renderer.Entry> buffer, List<Integer> run, FormattingOptions options) {
        if( run.size() < 2 )
            return;

        var start = -1;
        for( int j = run.get(0) - 1; j >= 0; j-- ) {
            if( buffer.get(j).token().isNewline() ) {
                start = j;
                break;
            }
        }
        if( start < 0 )
            return;

        var widths = new int[run.size()];
        var commentOnly = new boolean[run.size()];
        if( !measure(buffer, start, run, options, widths, commentOnly) )
            return;

        var allCommentOnly = true;
        for( var flag : commentOnly )
            allCommentOnly &= flag;

        int column;
        if( allCommentOnly ) {
            column = widths[0];
        }
        else {
            var first = (Token.Comment) buffer.get(run.get(0)).token();
            column = ((Position.Source) first.position()).column();
            for( int k = 0; k < run.size(); k++ )
                column = Math.max(column, commentOnly[k] ? widths[k] : widths[k] + 1);
        }

        for( int k = 0; k < run.size(); k++ ) {
            var index = run.get(k);
            var entry = buffer.get(index);
            var comment = (Token.Comment) entry.token();
            var minimum = commentOnly[k] ? 0 : 1;
            var padding = Math.max(minimum, column - widths[k]);
            buffer.set(index, entry.withToken(comment.withPosition(new Position.Relative(padding))));
        }
    }

    /**
     * Compute the rendered width of each line of a run up to its
     * comment, replaying the spacing rules of the renderer.
     *
     * @return false if the lines cannot be measured
     */
    private static boolean measure(List<Renderer.Entry> buffer, int start, List<Integer> run, FormattingOptions options, int[] widths, boolean[] commentOnly) {
        var end = run.get(run.size() - 1);
        var candidate = 0;
        var width = 0;
        var lineStart = true;
        var hasCode = false;
        Token last = buffer.get(start).token();
        for( int j = start; j <= end; j++ ) {
            var entry = buffer.get(j);
            var token = entry.token();
            if( token.isNewline() ) {
                width = 0;
                lineStart = true;
                hasCode = false;
                last = token;
                continue;
            }
            if( j + 1 < buffer.size() && !Spacing.canPrecede(token, buffer.get(j + 1).token()) )
                continue;
            if( lineStart ) {
                width = options.indentSize() * entry.indent().depth();
                lineStart = false;
            }
            if( candidate < run.size() && j == run.get(candidate) ) {
                widths[candidate] = width;
                commentOnly[candidate] = !hasCode;
                candidate++;
                continue;
            }
            if( token.text().contains("\n") )
                return false;
            width += Spacing.delimitingSpaceLen(last, token) + token.width();
            hasCode = true;
            last = token;
        }
        return candidate == run.size();
    }

    private static int countNewlines(Token token) {
        if( !(token instanceof Token.Raw) && !(token instanceof Token.Comment) && !(token instanceof Token.StepOrStutter) )
            return 0;
        return (int) token.text().chars().filter(c -> c == '\n').count();
    }
}
