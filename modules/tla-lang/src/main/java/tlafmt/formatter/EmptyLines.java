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

import tlafmt.ast.SyntaxNode;

/**
 * Reproduces the blank lines of the source, squashing any run
 * of blank lines into a single one.
 */
public class EmptyLines {

    private int lastRow;

    public EmptyLines(int startRow) {
        this.lastRow = startRow;
    }

    /**
     * Emit the line breaks that separate the given node from the
     * previously visited one, and make the node the last visited.
     *
     * @param node
     * @param renderer
     */
    public void maybeInsert(SyntaxNode node, Renderer renderer) {
        var existing = node.startPosition().row() - lastRow;
        if( existing >= 1 )
            renderer.push(Token.SOURCE_NEWLINE);
        if( existing >= 2 )
            renderer.push(Token.SOURCE_NEWLINE);
        lastRow = node.endPosition().row();
    }

    /**
     * Make the node the last visited one without emitting anything.
     *
     * @param node
     */
    public void suppress(SyntaxNode node) {
        lastRow = node.endPosition().row();
    }
}
