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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import tlafmt.exception.ParseException;
import tlafmt.exception.TlaFormatException;
import tlafmt.formatter.FormattingOptions;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
class ParsedDocumentTest {

    @Test
    void shouldRejectMissingInput() {
        assertThrows(ParseException.class, () -> ParsedDocument.parse(null));
    }

    @Test
    void shouldExposeSyntaxTree() throws TlaFormatException {
        var text = "---- MODULE T ----\nx == 1\n====\n";
        var document = ParsedDocument.parse(text);
        assertEquals("source_file", document.getRoot().kind());
        assertEquals(text, document.getText());
    }

    @Test
    void shouldWriteUtf8() throws Exception {
        var document = ParsedDocument.parse("---- MODULE T ----\nx == \"ü\"\n====\n");
        var out = new ByteArrayOutputStream();
        document.format(out);
        var result = out.toString(StandardCharsets.UTF_8);
        assertTrue(result.contains("x == \"ü\"\n"));
        assertEquals(document.format(), result);
    }

    @Test
    void shouldFormatWithFormatter() throws TlaFormatException {
        var formatter = new TlaFormatter(new FormattingOptions(40, 2, false));
        assertEquals(40, formatter.getOptions().lineWidth());
        var result = formatter.format("---- MODULE T ----\nx==1\n====\n");
        assertTrue(result.startsWith("--------------- MODULE T ---------------\n"));
        assertTrue(result.contains("\nx == 1\n"));
        assertTrue(result.endsWith("========================================\n"));
    }

    @Test
    void shouldUseDefaultOptions() {
        assertEquals(FormattingOptions.defaults(), new TlaFormatter().getOptions());
    }
}
