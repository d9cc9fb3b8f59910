package com.jsrefactor.editor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Presents the {@code <script>} region of a single-file component (Vue,
 * Svelte) as the whole document. Selections and cursor positions are shifted
 * by the number of lines before the region. Documents without a script tag
 * pass through unchanged.
 */
public class ScriptRegionEditor implements Editor {
    private static final String OPENING_TAG = "<script";
    private static final String CLOSING_TAG = "</script>";

    private final Editor delegate;

    public ScriptRegionEditor(Editor delegate) {
        this.delegate = delegate;
    }

    @Override
    public String code() {
        String document = delegate.code();
        Region region = region(document);
        return document.substring(region.start(), region.end());
    }

    @Override
    public Selection selection() {
        Selection selection = delegate.selection();
        int offsetLines = offsetLinesCount(delegate.code());
        if (selection.start().line() < offsetLines) {
            return Selection.cursorAt(0, 0);
        }
        return selection.removeLines(offsetLines);
    }

    @Override
    public CompletableFuture<Void> write(String code) {
        return delegate.write(replaceRegion(code));
    }

    @Override
    public CompletableFuture<Void> write(String code, Position cursor) {
        int offsetLines = offsetLinesCount(delegate.code());
        return delegate.write(replaceRegion(code), cursor.addLines(offsetLines));
    }

    @Override
    public <T> CompletableFuture<Optional<Choice<T>>> askUser(List<Choice<T>> choices) {
        return delegate.askUser(choices);
    }

    @Override
    public void showError(ErrorReason reason) {
        delegate.showError(reason);
    }

    private String replaceRegion(String code) {
        String document = delegate.code();
        Region region = region(document);
        return document.substring(0, region.start()) + code + document.substring(region.end());
    }

    private int offsetLinesCount(String document) {
        int start = region(document).start();
        int lines = 0;
        for (int i = 0; i < start; i++) {
            if (document.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }

    // Content between the opening tag's '>' and the closing tag
    private static Region region(String document) {
        int tag = document.indexOf(OPENING_TAG);
        if (tag < 0) {
            return new Region(0, document.length());
        }
        int tagEnd = document.indexOf('>', tag);
        if (tagEnd < 0) {
            return new Region(0, document.length());
        }
        int start = tagEnd + 1;
        int end = document.indexOf(CLOSING_TAG, start);
        return new Region(start, end < 0 ? document.length() : end);
    }

    private record Region(int start, int end) {
    }
}
