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
package tlafmt.exception;

import tlafmt.ast.SourcePosition;

/**
 * Raised when a well-formed tree is missing a child the formatter needs.
 *
 * @author Paolo Di Tommaso <paolo.ditommaso@gmail.com>
 */
public abstract class StructuralException extends TlaFormatException {

    private final SourcePosition position;

    protected StructuralException(String message, SourcePosition position) {
        super(message + " at " + position);
        this.position = position;
    }

    /**
     * Get the start of the node that could not be formatted.
     */
    public SourcePosition getPosition() {
        return position;
    }
}
