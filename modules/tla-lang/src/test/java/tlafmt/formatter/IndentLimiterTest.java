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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndentLimiterTest {

    /**
     * Build a buffer of lines, each a newline followed by a token,
     * at the given depths.
     */
    private static List<Renderer.Entry> lines(int... depths) {
        var buffer = new ArrayList<Renderer.Entry>();
        for( var depth : depths ) {
            buffer.add(new Renderer.Entry(Token.NEWLINE, new Indent(depth)));
            buffer.add(new Renderer.Entry(Symbol.BANG, new Indent(depth)));
        }
        return buffer;
    }

    private static int[] tokenDepths(List<Renderer.Entry> buffer) {
        return buffer.stream()
            .filter(entry -> !entry.token().isNewline())
            .mapToInt(entry -> entry.indent().depth())
            .toArray();
    }

    private static int[] newlineDepths(List<Renderer.Entry> buffer) {
        return buffer.stream()
            .filter(entry -> entry.token().isNewline())
            .mapToInt(entry -> entry.indent().depth())
            .toArray();
    }

    @Test
    void shouldKeepRegularIndentation() {
        var buffer = lines(1, 1, 1);
        IndentLimiter.limit(buffer);
        assertArrayEquals(new int[] { 1, 1, 1 }, tokenDepths(buffer));
    }

    @Test
    void shouldDedentManyLevels() {
        var buffer = lines(1, 3, 5, 3, 1);
        IndentLimiter.limit(buffer);
        assertArrayEquals(new int[] { 1, 2, 3, 2, 1 }, tokenDepths(buffer));
        // newline tokens are not rewritten
        assertArrayEquals(new int[] { 1, 3, 5, 3, 1 }, newlineDepths(buffer));
    }

    @Test
    void shouldDedentOneLevel() {
        var buffer = lines(1, 3, 1);
        IndentLimiter.limit(buffer);
        assertArrayEquals(new int[] { 1, 2, 1 }, tokenDepths(buffer));
    }

    @Test
    void shouldDedentStepJump() {
        var buffer = lines(1, 2, 5, 5, 1);
        IndentLimiter.limit(buffer);
        assertArrayEquals(new int[] { 1, 2, 3, 3, 1 }, tokenDepths(buffer));
    }

    @Test
    void shouldKeepBlockWithDeferredLevel() {
        var buffer = lines(1, 3, 2);
        IndentLimiter.limit(buffer);
        assertArrayEquals(new int[] { 1, 3, 2 }, tokenDepths(buffer));
    }

    @Test
    void shouldIgnoreTokensInsideLine() {
        var buffer = new ArrayList<Renderer.Entry>();
        buffer.add(new Renderer.Entry(new Token.Ident("a"), Indent.ZERO));
        buffer.add(new Renderer.Entry(new Token.Ident("b"), new Indent(7)));
        buffer.add(new Renderer.Entry(Token.NEWLINE, Indent.ZERO));
        buffer.add(new Renderer.Entry(new Token.Ident("c"), Indent.ZERO));
        IndentLimiter.limit(buffer);
        assertEquals(7, buffer.get(1).indent().depth());
    }

    @Test
    void shouldHandleEmptyBuffer() {
        var buffer = new ArrayList<Renderer.Entry>();
        IndentLimiter.limit(buffer);
        assertTrue(buffer.isEmpty());
    }
}
