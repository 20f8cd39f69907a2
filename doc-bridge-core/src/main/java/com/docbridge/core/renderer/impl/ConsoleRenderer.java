package com.docbridge.core.renderer.impl;

import com.docbridge.core.renderer.GeneratedFile;
import com.docbridge.core.renderer.GeneratedOutput;
import com.docbridge.core.renderer.OutputRenderer;
import com.docbridge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints translated files to the console.
 *
 * <p>With headers enabled each file is preceded by an AsciiDoc comment line naming it, so
 * the combined output is still valid AsciiDoc. A single file without headers is printed
 * exactly as translated.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String HEADER_PREFIX = "// ==== ";
    private static final String HEADER_SUFFIX = " ====";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        PrintStream console = context.console();
        log.debug("Printing {} files to console (headers: {})", output.files().size(), context.showHeaders());

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (context.showHeaders()) {
                if (i > 0) {
                    console.println();
                }
                console.println(HEADER_PREFIX + file.relativePath() + HEADER_SUFFIX);
            }
            console.print(file.content());
        }
        console.flush();
    }
}
