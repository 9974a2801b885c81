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

import com.google.common.base.Preconditions;

/**
 * Indentation depth, in indentation units.
 */
public record Indent(int depth) {

    public static final int MAX_DEPTH = 255;

    public static final Indent ZERO = new Indent(0);

    public Indent {
        Preconditions.checkArgument(depth >= 0 && depth <= MAX_DEPTH, "indent depth out of range: %s", depth);
    }

    public Indent inc() {
        Preconditions.checkState(depth < MAX_DEPTH, "indent overflow");
        return new Indent(depth + 1);
    }

    public Indent dec() {
        Preconditions.checkState(depth > 0, "indent underflow");
        return new Indent(depth - 1);
    }

    public Indent minus(int levels) {
        return new Indent(depth - levels);
    }

    public static Indent max(Indent a, Indent b) {
        return a.depth >= b.depth ? a : b;
    }
}
