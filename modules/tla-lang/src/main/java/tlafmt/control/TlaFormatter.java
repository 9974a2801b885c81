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
package tlafmt.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tlafmt.exception.TlaFormatException;
import tlafmt.formatter.FormattingOptions;

/**
 * Format TLA+ source text with a given set of options.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class TlaFormatter {

    private static final Logger log = LoggerFactory.getLogger(TlaFormatter.class);

    private final FormattingOptions options;

    public TlaFormatter() {
        this(FormattingOptions.defaults());
    }

    public TlaFormatter(FormattingOptions options) {
        this.options = options;
    }

    public FormattingOptions getOptions() {
        return options;
    }

    /**
     * Parse and format a document.
     *
     * @param text
     */
    public String format(String text) throws TlaFormatException {
        var document = ParsedDocument.parse(text);
        var result = document.format(options);
        log.trace("Formatted {} chars into {} chars", text.length(), result.length());
        return result;
    }
}
