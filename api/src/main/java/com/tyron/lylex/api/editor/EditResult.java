package com.tyron.lylex.api.editor;

/**
 * What an edit cost in terms of lexing.
 *
 * @param anchorLine    first line that was re-lexed
 * @param relexedLines  number of lines lexed again
 * @param resyncLine    first line whose previous tokens were reused after the edit, -1 if lexing ran to the end
 * @param reusedLines   number of lines after the edit whose tokens were reused
 * @param delta         change of the text length
 */
public record EditResult(int anchorLine, int relexedLines, int resyncLine, int reusedLines, int delta) {

    public boolean isResynced() {
        return resyncLine >= 0;
    }
}
