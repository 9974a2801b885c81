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

import java.util.List;

/**
 * Removes excessive indentation from the token buffer.
 *
 * A block of lines that is indented by more than one level relative
 * to the line that opens it, without any line at exactly one level,
 * is shifted left so that its shallowest line sits one level deeper
 * than the opening line. Only tokens that start a line are read
 * or rewritten.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
final class IndentLimiter {

    private enum State { SKIPPING, SCANNING_MIN, REWRITING }

    private IndentLimiter() {}

    static void limit(List<Renderer.Entry> buffer) {
        limit(buffer, 0);
    }

    /**
     * Process the block that starts at the given offset.
     *
     * @return the number of tokens consumed, ending at the first line
     *     that is shallower than the start of the block
     */
    private static int limit(List<Renderer.Entry> buffer, int offset) {
        if( offset >= buffer.size() )
            return 0;

        var current = buffer.get(offset).indent().depth();
        var state = State.SKIPPING;
        var startIndex = 0;
        var min = 0;
        var delta = 0;
        var lastWasNewline = false;
        var i = 0;
        while( offset + i < buffer.size() ) {
            var entry = buffer.get(offset + i);
            var last = lastWasNewline;
            lastWasNewline = entry.token().isNewline();
            if( !last ) {
                i++;
                continue;
            }

            var depth = entry.indent().depth();
            switch( state ) {
                case SKIPPING:
                    if( depth == current + 1 ) {
                        // nested block with the expected indentation
                        i += limit(buffer, offset + i);
                        lastWasNewline = true;
                        continue;
                    }
                    if( depth > current + 1 ) {
                        state = State.SCANNING_MIN;
                        startIndex = i;
                        min = depth;
                    }
                    else if( depth < current ) {
                        return i;
                    }
                    break;

                case SCANNING_MIN:
                    if( depth <= current ) {
                        state = State.REWRITING;
                        delta = min - current - 1;
                        i = startIndex;
                        lastWasNewline = true;
                        continue;
                    }
                    if( min == current + 1 ) {
                        state = State.SKIPPING;
                        i = startIndex + limit(buffer, offset + startIndex);
                        lastWasNewline = true;
                        continue;
                    }
                    min = Math.min(min, depth);
                    break;

                case REWRITING:
                    if( depth > current ) {
                        buffer.set(offset + i, entry.withIndent(entry.indent().minus(delta)));
                        break;
                    }
                    state = State.SKIPPING;
                    i = startIndex + limit(buffer, offset + startIndex);
                    lastWasNewline = true;
                    continue;
            }
            i++;
        }
        return i;
    }
}
