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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndentTest {

    @Test
    void shouldIncrementAndDecrement() {
        var indent = Indent.ZERO.inc().inc();
        assertEquals(2, indent.depth());
        assertEquals(1, indent.dec().depth());
        assertEquals(Indent.ZERO, indent.minus(2));
    }

    @Test
    void shouldRejectUnderflow() {
        assertThrows(IllegalStateException.class, Indent.ZERO::dec);
    }

    @Test
    void shouldRejectOverflow() {
        var indent = new Indent(Indent.MAX_DEPTH);
        assertThrows(IllegalStateException.class, indent::inc);
        assertThrows(IllegalArgumentException.class, () -> new Indent(-1));
    }

    @Test
    void shouldPickDeeperIndent() {
        assertEquals(new Indent(3), Indent.max(new Indent(1), new Indent(3)));
        assertEquals(new Indent(3), Indent.max(new Indent(3), Indent.ZERO));
    }
}
