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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Immutable syntax tree node built by the parser.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public final class TreeNode implements SyntaxNode {

    private final SourceText source;

    private final String kind;

    private final boolean named;

    private final int startOffset;

    private final int endOffset;

    private final SourcePosition startPosition;

    private final SourcePosition endPosition;

    private final List<SyntaxNode> children;

    private TreeNode parent;

    private TreeNode(SourceText source, String kind, boolean named, int startOffset, int endOffset, SourcePosition startPosition, SourcePosition endPosition, List<TreeNode> children) {
        this.source = source;
        this.kind = kind;
        this.named = named;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.children = ImmutableList.copyOf(children);
        for( var child : children ) {
            Preconditions.checkState(child.parent == null, "node %s already has a parent", child.kind);
            child.parent = this;
        }
    }

    /**
     * Create a node without children covering the given span.
     */
    public static TreeNode leaf(SourceText source, String kind, boolean named, int startOffset, int endOffset, SourcePosition startPosition, SourcePosition endPosition) {
        return new TreeNode(source, kind, named, startOffset, endOffset, startPosition, endPosition, List.of());
    }

    /**
     * Create a named node spanning its children.
     */
    public static TreeNode node(SourceText source, String kind, List<TreeNode> children) {
        Preconditions.checkArgument(!children.isEmpty(), "node %s must have children", kind);
        var first = children.get(0);
        var last = children.get(children.size() - 1);
        return new TreeNode(source, kind, true, first.startOffset, last.endOffset, first.startPosition, last.endPosition, children);
    }

    /**
     * Create the root node, which may be empty.
     */
    public static TreeNode root(SourceText source, String kind, List<TreeNode> children) {
        if( !children.isEmpty() )
            return node(source, kind, children);
        var origin = new SourcePosition(0, 0);
        return new TreeNode(source, kind, true, 0, 0, origin, origin, children);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public int startOffset() {
        return startOffset;
    }

    @Override
    public int endOffset() {
        return endOffset;
    }

    @Override
    public SourcePosition startPosition() {
        return startPosition;
    }

    @Override
    public SourcePosition endPosition() {
        return endPosition;
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public List<SyntaxNode> children() {
        return children;
    }

    @Override
    public String text() {
        return source.slice(startOffset, endOffset);
    }

    @Override
    public String toString() {
        if( children.isEmpty() )
            return named ? "(" + kind + ")" : "\"" + kind + "\"";
        var builder = new StringBuilder();
        builder.append('(').append(kind);
        for( var child : children ) {
            if( child.isNamed() )
                builder.append(' ').append(child);
        }
        builder.append(')');
        return builder.toString();
    }
}
