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

import java.io.FilterWriter;
import java.io.IOException;
import java.io.Writer;

import com.google.common.base.Strings;

/**
 * Writer that indents every line at its first write.
 *
 * Lines that stay empty are not indented.
 *
 * @author Ben Sherman <bentshermann@gmail.com>
 */
public class IndentWriter extends FilterWriter {

    private final int indentSize;

    private int depth;

    private boolean atLineStart;

    public IndentWriter(Writer out, int indentSize) {
        super(out);
        this.indentSize = indentSize;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    @Override
    public void write(int c) throws IOException {
        write(String.valueOf((char) c));
    }

    @Override
    public void write(char[] cbuf, int off, int len) throws IOException {
        write(new String(cbuf, off, len));
    }

    @Override
    public void write(String str, int off, int len) throws IOException {
        var text = str.substring(off, off + len);
        var start = 0;
        while( start < text.length() ) {
            var newline = text.indexOf('\n', start);
            var end = newline < 0 ? text.length() : newline + 1;
            var chunk = text.substring(start, end);
            if( atLineStart && !"\n".equals(chunk) )
                out.write(Strings.repeat(" ", indentSize * depth));
            out.write(chunk);
            atLineStart = chunk.endsWith("\n");
            start = end;
        }
    }
}
