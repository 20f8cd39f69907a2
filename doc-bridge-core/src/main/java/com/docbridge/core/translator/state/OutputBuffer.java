package com.docbridge.core.translator.state;

import com.docbridge.core.util.TextEncoding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only sequence of output fragments, concatenated once at the end of a translation.
 *
 * <p>The buffer can be muted for a subtree. Fragments appended while muted are dropped
 * before they are stored; fragments already stored are never removed or changed.
 * Mute calls nest and must be matched by {@link #unmute()}.
 */
public final class OutputBuffer {

    private final List<String> fragments = new ArrayList<>();
    private int muteDepth;

    /**
     * Appends a fragment unless the buffer is muted. Null and empty fragments are ignored.
     *
     * @param fragment text to append
     */
    public void append(String fragment) {
        if (fragment == null || fragment.isEmpty() || muteDepth > 0) {
            return;
        }
        fragments.add(fragment);
    }

    public void mute() {
        muteDepth++;
    }

    /**
     * Ends the innermost mute.
     *
     * @throws IllegalStateException if the buffer is not muted
     */
    public void unmute() {
        if (muteDepth == 0) {
            throw new IllegalStateException("Output buffer is not muted");
        }
        muteDepth--;
    }

    public boolean isMuted() {
        return muteDepth > 0;
    }

    /**
     * Returns the stored fragments in append order.
     *
     * @return read-only view of the fragments
     */
    public List<String> fragments() {
        return Collections.unmodifiableList(fragments);
    }

    /**
     * Concatenates all fragments into the final text.
     *
     * @return assembled text
     */
    public String assemble() {
        return String.join("", fragments);
    }

    /**
     * Assembles the text and encodes it as UTF-8.
     *
     * @param origin description of the document for log messages
     * @return UTF-8 bytes
     */
    public byte[] assembleUtf8(String origin) {
        return TextEncoding.toUtf8(assemble(), origin);
    }
}
