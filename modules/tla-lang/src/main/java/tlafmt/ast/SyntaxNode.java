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
package tlafmt.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A node of a concrete syntax tree.
 *
 * Named nodes carry structure (definitions, expressions, comments),
 * anonymous nodes are punctuation and keywords that only matter
 * through their kind.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public interface SyntaxNode {

    String kind();

    boolean isNamed();

    default boolean isError() {
        return NodeKinds.ERROR.equals(kind());
    }

    int startOffset();

    int endOffset();

    SourcePosition startPosition();

    SourcePosition endPosition();

    /**
     * Get the enclosing node, or null for the root.
     */
    SyntaxNode parent();

    List<SyntaxNode> children();

    default List<SyntaxNode> namedChildren() {
        return children().stream()
            .filter(SyntaxNode::isNamed)
            .collect(Collectors.toList());
    }

    /**
     * Get the named child at the given index, or null if there
     * are not that many named children.
     *
     * @param index
     */
    default SyntaxNode namedChild(int index) {
        var named = namedChildren();
        return index < named.size() ? named.get(index) : null;
    }

    /**
     * Get the source text spanned by this node.
     */
    String text();
}
