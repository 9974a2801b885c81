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
 * Formatting options.
 *
 * @param lineWidth width of module header and divider lines
 * @param indentSize number of spaces per indentation level
 * @param reportDiagnostics whether to log syntax errors and unformatted nodes
 */
public record FormattingOptions(
    int lineWidth,
    int indentSize,
    boolean reportDiagnostics
) {

    public FormattingOptions {
        Preconditions.checkArgument(lineWidth > 0, "line width must be positive");
        Preconditions.checkArgument(indentSize > 0, "indent size must be positive");
    }

    public static FormattingOptions defaults() {
        return new FormattingOptions(80, 4, true);
    }

    public FormattingOptions withReportDiagnostics(boolean reportDiagnostics) {
        return new FormattingOptions(lineWidth, indentSize, reportDiagnostics);
    }
}
