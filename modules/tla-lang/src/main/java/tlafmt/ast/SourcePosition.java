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

/**
 * Zero-based row and column of a location in the source text.
 *
 * Columns are counted in code points.
 */
public record SourcePosition(int row, int column) {

    @Override
    public String toString() {
        return (row + 1) + ":" + (column + 1);
    }
}
