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

import com.google.common.base.Preconditions;

/**
 * The code points of a parsed document, addressed with the
 * same offsets as the lexer tokens.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class SourceText {

    private final String text;

    private final int[] codePoints;

    public SourceText(String text) {
        this.text = text;
        this.codePoints = text.codePoints().toArray();
    }

    public String slice(int start, int end) {
        Preconditions.checkPositionIndexes(start, end, codePoints.length);
        return new String(codePoints, start, end - start);
    }

    public int length() {
        return codePoints.length;
    }

    @Override
    public String toString() {
        return text;
    }
}
