package com.tyron.editbox.core.session;

import com.tyron.editbox.api.editor.Alignment;
import com.tyron.editbox.api.editor.Clipboard;
import com.tyron.editbox.api.editor.EditBox;
import com.tyron.editbox.api.editor.EditBoxListener;
import com.tyron.editbox.api.editor.EditResult;
import com.tyron.editbox.api.editor.TextMetrics;
import com.tyron.editbox.api.options.EditBoxOptions;
import com.tyron.editbox.core.display.DisplayProjector;
import com.tyron.editbox.core.display.ScrollWindow;
import com.tyron.editbox.core.options.InvalidOptionsException;
import com.tyron.editbox.core.selection.SelectionModel;
import com.tyron.editbox.core.text.TextBuffer;
import com.tyron.editbox.core.text.WordBoundaries;
import com.tyron.editbox.core.validation.InvalidPatternException;
import com.tyron.editbox.core.validation.TextValidator;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editing state of a single-line edit box.
 *
 * Every edit builds a candidate text first, checks it against the character limit, the input
 * validator and (when enabled) the visible width, and only then commits text, selection, displayed
 * text and scroll position together. A rejected candidate leaves the session untouched and notifies
 * nobody.
 *
 * This class is UI-agnostic; a widget owns one session and forwards its input to it, either
 * directly or through an {@link EditBoxInputHandler}. It is not thread-safe; all calls are expected
 * on the UI thread.
 */
public final class EditSession implements EditBox {

    private static final Logger LOG = Logger.getLogger(EditSession.class.getName());

    private final Clipboard clipboard;
    private final CopyOnWriteArrayList<EditBoxListener> listeners = new CopyOnWriteArrayList<>();

    private final SelectionModel selection = new SelectionModel();
    private final DisplayProjector projector;
    private final ScrollWindow scrollWindow = new ScrollWindow();

    private TextBuffer text = TextBuffer.EMPTY;
    private TextValidator validator = TextValidator.acceptAll();

    private int maxChars;
    private int passwordChar;
    private boolean limitWidth;
    private boolean readOnly;
    private boolean enabled = true;
    private Alignment alignment = Alignment.LEFT;
    private String suffix = "";
    private String defaultText = "";
    private float viewportWidth;

    private long modificationStamp;

    public EditSession(@NotNull TextMetrics metrics, @NotNull Clipboard clipboard) {
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
        this.projector = new DisplayProjector(Objects.requireNonNull(metrics, "metrics"));
    }

    // =========================================================================
    // Text
    // =========================================================================

    @NotNull
    @Override
    public String getText() {
        return text.toString();
    }

    @Override
    public void setText(@NotNull String newText) {
        Objects.requireNonNull(newText, "text");
        TextBuffer candidate = fitText(TextBuffer.of(newText));
        commit(candidate, candidate.length(), candidate.length());
    }

    /**
     * Same as {@link #setText(String)} but places the caret at {@code caretPosition} (clamped to the
     * stored text) instead of at the end.
     */
    public void setText(@NotNull String newText, int caretPosition) {
        Objects.requireNonNull(newText, "text");
        TextBuffer candidate = fitText(TextBuffer.of(newText));
        int caret = clamp(caretPosition, candidate.length());
        commit(candidate, caret, caret);
    }

    /**
     * Cuts a whole-text replacement down to the limits and clears it when it fails the validator.
     * Unlike typed input, a mismatching text is not rejected: the edit box ends up empty.
     */
    private TextBuffer fitText(TextBuffer candidate) {
        if (maxChars > 0 && candidate.length() > maxChars) {
            candidate = candidate.truncate(maxChars);
        }
        if (limitWidth) {
            float visible = getVisibleWidth();
            while (!candidate.isEmpty() && projector.measure(candidate, passwordChar) > visible) {
                candidate = candidate.truncate(candidate.length() - 1);
            }
        }
        if (!validator.matches(candidate.toString())) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("edit action=setText result=cleared reason=pattern validator=" + validator.getPattern());
            }
            return TextBuffer.EMPTY;
        }
        return candidate;
    }

    @NotNull
    @Override
    public String getDisplayedText() {
        return projector.getDisplayedText();
    }

    /**
     * @return the displayed text starting at the first visible code point.
     */
    @NotNull
    public String getVisibleDisplayedText() {
        TextBuffer displayed = projector.getDisplayed();
        return displayed.substring(Math.min(scrollWindow.getCropPosition(), displayed.length()), displayed.length()).toString();
    }

    @NotNull
    @Override
    public String getSelectedText() {
        return text.substring(selection.getLow(), selection.getHigh()).toString();
    }

    public int getTextLength() {
        return text.length();
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }

    // =========================================================================
    // Mutating intents
    // =========================================================================

    @Override
    public EditResult insertCharacter(int codePoint) {
        if (readOnly) {
            return EditResult.READ_ONLY;
        }
        if (!isPrintable(codePoint)) {
            return EditResult.NO_CHANGE;
        }

        int low = selection.getLow();
        TextBuffer candidate = text.replaceRange(low, selection.getHigh(), TextBuffer.ofCodePoint(codePoint));
        EditResult check = checkCandidate(candidate);
        if (check != EditResult.APPLIED) {
            logRejected("insert", check);
            return check;
        }

        commit(candidate, low + 1, low + 1);
        return EditResult.APPLIED;
    }

    /**
     * Removes the selected code points. Deleting never makes the text longer or wider, so it is
     * always committed, even when the remaining text happens not to match the validator.
     */
    @Override
    public EditResult deleteSelectedCharacters() {
        if (readOnly) {
            return EditResult.READ_ONLY;
        }
        if (!selection.hasSelection()) {
            return EditResult.NO_CHANGE;
        }
        int low = selection.getLow();
        return deleteRange("deleteSelection", low, selection.getHigh());
    }

    @Override
    public EditResult backspace() {
        if (readOnly) {
            return EditResult.READ_ONLY;
        }
        if (selection.hasSelection()) {
            return deleteSelectedCharacters();
        }
        int caret = selection.getCaret();
        if (caret == 0) {
            return EditResult.NO_CHANGE;
        }
        return deleteRange("backspace", caret - 1, caret);
    }

    @Override
    public EditResult deleteForward() {
        if (readOnly) {
            return EditResult.READ_ONLY;
        }
        if (selection.hasSelection()) {
            return deleteSelectedCharacters();
        }
        int caret = selection.getCaret();
        if (caret >= text.length()) {
            return EditResult.NO_CHANGE;
        }
        return deleteRange("delete", caret, caret + 1);
    }

    private EditResult deleteRange(String action, int low, int high) {
        TextBuffer candidate = text.deleteRange(low, high);
        if (!validator.matches(candidate.toString()) && LOG.isLoggable(Level.FINE)) {
            LOG.fine("edit action=" + action + " result=applied note=patternMismatch validator=" + validator.getPattern());
        }
        commit(candidate, low, low);
        return EditResult.APPLIED;
    }

    @Override
    public void copy() {
        if (!selection.hasSelection()) {
            return;
        }
        String selected = getSelectedText();
        try {
            clipboard.setContents(selected);
        } catch (RuntimeException e) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.log(Level.WARNING, "clipboard action=write result=fail length=" + selected.length(), e);
            }
        }
    }

    @Override
    public EditResult cut() {
        copy();
        if (readOnly) {
            return EditResult.READ_ONLY;
        }
        return deleteSelectedCharacters();
    }

    /**
     * Inserts the clipboard text as one unit, replacing the selection.
     * <p>
     * The clipboard text goes through the same character filter as typing, with line breaks and
     * tabs turned into spaces. Unlike typing, a paste that is too long is not rejected: the pasted
     * run is cut to the characters that still fit under the character limit (and, when the text
     * width is limited, in the visible width). The resulting text is then validated once and the paste is dropped as a
     * whole if it does not match.
     */
    @Override
    public EditResult paste() {
        if (readOnly) {
            return EditResult.READ_ONLY;
        }
        String contents = readClipboard();
        if (contents == null || contents.isEmpty()) {
            return EditResult.NO_CHANGE;
        }

        TextBuffer run = toPastedRun(contents);
        if (run.isEmpty()) {
            return EditResult.NO_CHANGE;
        }
        int low = selection.getLow();
        TextBuffer base = text.deleteRange(low, selection.getHigh());

        if (maxChars > 0) {
            int budget = maxChars - base.length();
            if (budget <= 0) {
                logRejected("paste", EditResult.REJECTED_LENGTH);
                return EditResult.REJECTED_LENGTH;
            }
            run = run.truncate(budget);
        }

        TextBuffer candidate = base.insertAt(low, run);
        if (limitWidth) {
            float visible = getVisibleWidth();
            while (!run.isEmpty() && projector.measure(candidate, passwordChar) > visible) {
                run = run.truncate(run.length() - 1);
                candidate = base.insertAt(low, run);
            }
            if (run.isEmpty()) {
                logRejected("paste", EditResult.REJECTED_WIDTH);
                return EditResult.REJECTED_WIDTH;
            }
        }

        if (!validator.matches(candidate.toString())) {
            logRejected("paste", EditResult.REJECTED_PATTERN);
            return EditResult.REJECTED_PATTERN;
        }

        int caret = low + run.length();
        commit(candidate, caret, caret);
        return EditResult.APPLIED;
    }

    private String readClipboard() {
        try {
            return clipboard.getContents();
        } catch (RuntimeException e) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.log(Level.WARNING, "clipboard action=read result=fail", e);
            }
            return null;
        }
    }

    /**
     * Line breaks and tabs become spaces; other code points that typing would refuse are dropped.
     */
    private static TextBuffer toPastedRun(String contents) {
        int[] codePoints = contents.replace("\r\n", " ")
                .codePoints()
                .map(cp -> cp == '\r' || cp == '\n' || cp == '\t' ? ' ' : cp)
                .filter(EditSession::isPrintable)
                .toArray();
        return TextBuffer.of(new String(codePoints, 0, codePoints.length));
    }

    // =========================================================================
    // Caret and selection
    // =========================================================================

    @Override
    public int getCaretPosition() {
        return selection.getCaret();
    }

    @Override
    public void setCaretPosition(int caretPosition) {
        moveCaretTo(caretPosition, false);
    }

    public int getSelectionStart() {
        return selection.getSelectionStart();
    }

    public int getSelectionEnd() {
        return selection.getSelectionEnd();
    }

    public boolean hasSelection() {
        return selection.hasSelection();
    }

    /**
     * Moves the caret to {@code index} (clamped to the text). When extending, the fixed anchor stays
     * and the selection grows or shrinks towards the caret; otherwise the selection collapses.
     */
    public void moveCaretTo(int index, boolean extendSelection) {
        int target = clamp(index, text.length());
        if (extendSelection) {
            commitSelection(selection.getSelectionStart(), target);
        } else {
            commitSelection(target, target);
        }
    }

    @Override
    public void selectText(int start, int length) {
        int len = text.length();
        int s = clamp(start, len);
        int e = (int) Math.min((long) s + Math.max(length, 0), len);
        commitSelection(s, e);
    }

    @Override
    public void moveCaretLeft(boolean extendSelection) {
        if (selection.hasSelection() && !extendSelection) {
            moveCaretTo(selection.getLow(), false);
            return;
        }
        moveCaretTo(selection.getCaret() - 1, extendSelection);
    }

    @Override
    public void moveCaretRight(boolean extendSelection) {
        if (selection.hasSelection() && !extendSelection) {
            moveCaretTo(selection.getHigh(), false);
            return;
        }
        moveCaretTo(selection.getCaret() + 1, extendSelection);
    }

    @Override
    public void moveCaretWordBegin(boolean extendSelection) {
        moveCaretTo(WordBoundaries.previousWordStart(text, selection.getCaret()), extendSelection);
    }

    @Override
    public void moveCaretWordEnd(boolean extendSelection) {
        moveCaretTo(WordBoundaries.nextWordEnd(text, selection.getCaret()), extendSelection);
    }

    public void moveCaretToStart(boolean extendSelection) {
        moveCaretTo(0, extendSelection);
    }

    public void moveCaretToEnd(boolean extendSelection) {
        moveCaretTo(text.length(), extendSelection);
    }

    // =========================================================================
    // Scrolling and hit testing
    // =========================================================================

    @Override
    public int findCaretPosition(float x) {
        return scrollWindow.findCaretPosition(x, projector, alignment, getVisibleWidth());
    }

    public int getCropPosition() {
        return scrollWindow.getCropPosition();
    }

    /**
     * @return the caret x position relative to the left edge of the visible text area.
     */
    public float getCaretPixelX() {
        return scrollWindow.caretPixelX(selection.getCaret(), projector, alignment, getVisibleWidth());
    }

    /**
     * Width available to the text: the viewport minus the room taken by the suffix.
     */
    public float getVisibleWidth() {
        float suffixWidth = projector.measure(suffix);
        return Math.max(0f, viewportWidth - suffixWidth);
    }

    /**
     * Must be called when the metrics start measuring differently, e.g. after a font change.
     */
    public void textMetricsChanged() {
        projector.invalidate();
        reapplyIfOverflowing();
        updateScroll();
    }

    // =========================================================================
    // Properties
    // =========================================================================

    public float getViewportWidth() {
        return viewportWidth;
    }

    public void setViewportWidth(float width) {
        if (!(width >= 0f)) {
            throw new IllegalArgumentException("viewport width must be >= 0: " + width);
        }
        viewportWidth = width;
        reapplyIfOverflowing();
        updateScroll();
    }

    public int getMaximumCharacters() {
        return maxChars;
    }

    /**
     * @param maxChars the character limit, {@code 0} for no limit. A longer text is cut.
     */
    public void setMaximumCharacters(int maxChars) {
        if (maxChars < 0) {
            throw new IllegalArgumentException("maxChars < 0: " + maxChars);
        }
        this.maxChars = maxChars;
        if (maxChars > 0 && text.length() > maxChars) {
            setText(getText());
        }
    }

    public int getPasswordCharacter() {
        return passwordChar;
    }

    /**
     * @param passwordChar the mask code point, {@code 0} to show the real text.
     */
    public void setPasswordCharacter(int passwordChar) {
        if (passwordChar != 0 && !isPrintable(passwordChar)) {
            throw new IllegalArgumentException("Not a printable code point: " + passwordChar);
        }
        if (this.passwordChar == passwordChar) {
            return;
        }
        this.passwordChar = passwordChar;
        projector.update(text, passwordChar);
        reapplyIfOverflowing();
        updateScroll();
    }

    public boolean isTextWidthLimited() {
        return limitWidth;
    }

    public void limitTextWidth(boolean limitWidth) {
        this.limitWidth = limitWidth;
        reapplyIfOverflowing();
        updateScroll();
    }

    public String getInputValidator() {
        return validator.getPattern();
    }

    /**
     * Replaces the input validator. The current text is checked against the new pattern and
     * cleared when it does not match.
     *
     * @return false when the pattern could not be compiled; the previous validator stays in place.
     */
    public boolean setInputValidator(@NotNull String pattern) {
        TextValidator compiled;
        try {
            compiled = TextValidator.compile(pattern);
        } catch (InvalidPatternException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "validator action=set result=invalid pattern=" + pattern, e);
            }
            return false;
        }
        validator = compiled;
        if (!validator.matches(getText())) {
            setText(getText());
        }
        return true;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * A read-only edit box can still be selected and copied from, and {@link #setText(String)} still works.
     */
    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * A disabled edit box ignores user input. Programmatic calls keep working.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Alignment getAlignment() {
        return alignment;
    }

    public void setAlignment(@NotNull Alignment alignment) {
        this.alignment = Objects.requireNonNull(alignment, "alignment");
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(@NotNull String suffix) {
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        reapplyIfOverflowing();
        updateScroll();
    }

    public String getDefaultText() {
        return defaultText;
    }

    /**
     * The default text is shown instead of the text while the edit box is empty. It is never masked.
     */
    public void setDefaultText(@NotNull String defaultText) {
        this.defaultText = Objects.requireNonNull(defaultText, "defaultText");
    }

    public boolean isShowingDefaultText() {
        return text.isEmpty() && !defaultText.isEmpty();
    }

    /**
     * Applies every property present in {@code options}; missing keys keep their current value.
     *
     * @throws InvalidOptionsException when a value cannot be applied
     */
    public void applyOptions(@NotNull EditBoxOptions options) {
        Objects.requireNonNull(options, "options");
        try {
            if (options.has(EditBoxOptions.VIEWPORT_WIDTH)) {
                setViewportWidth(options.getFloat(EditBoxOptions.VIEWPORT_WIDTH, viewportWidth));
            }
            if (options.has(EditBoxOptions.SUFFIX)) {
                setSuffix(options.get(EditBoxOptions.SUFFIX));
            }
            if (options.has(EditBoxOptions.MAX_CHARS)) {
                setMaximumCharacters(options.getInt(EditBoxOptions.MAX_CHARS, maxChars));
            }
            if (options.has(EditBoxOptions.PASSWORD_CHAR)) {
                setPasswordCharacter(options.getCodePoint(EditBoxOptions.PASSWORD_CHAR, passwordChar));
            }
            if (options.has(EditBoxOptions.LIMIT_WIDTH)) {
                limitTextWidth(options.getBoolean(EditBoxOptions.LIMIT_WIDTH, limitWidth));
            }
            if (options.has(EditBoxOptions.ALIGNMENT)) {
                setAlignment(Alignment.valueOf(options.get(EditBoxOptions.ALIGNMENT).trim().toUpperCase(Locale.ROOT)));
            }
            if (options.has(EditBoxOptions.READ_ONLY)) {
                setReadOnly(options.getBoolean(EditBoxOptions.READ_ONLY, readOnly));
            }
            if (options.has(EditBoxOptions.DEFAULT_TEXT)) {
                setDefaultText(options.get(EditBoxOptions.DEFAULT_TEXT));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException("Cannot apply " + options, e);
        }

        if (options.has(EditBoxOptions.VALIDATOR)) {
            String pattern = TextValidator.resolvePattern(options.get(EditBoxOptions.VALIDATOR));
            if (!setInputValidator(pattern)) {
                throw new InvalidOptionsException("Invalid " + EditBoxOptions.VALIDATOR + ": " + pattern);
            }
        }
    }

    // =========================================================================
    // Listeners
    // =========================================================================

    @Override
    public void addListener(EditBoxListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(EditBoxListener listener) {
        listeners.remove(listener);
    }

    void fireReturnKeyPressed() {
        String current = getText();
        for (EditBoxListener listener : listeners) {
            listener.returnKeyPressed(current);
        }
        fireReturnOrUnfocused();
    }

    void fireReturnOrUnfocused() {
        String current = getText();
        for (EditBoxListener listener : listeners) {
            listener.returnOrUnfocused(current);
        }
    }

    // =========================================================================
    // Commit
    // =========================================================================

    private EditResult checkCandidate(TextBuffer candidate) {
        if (maxChars > 0 && candidate.length() > maxChars) {
            return EditResult.REJECTED_LENGTH;
        }
        if (!validator.matches(candidate.toString())) {
            return EditResult.REJECTED_PATTERN;
        }
        if (limitWidth && projector.measure(candidate, passwordChar) > getVisibleWidth()) {
            return EditResult.REJECTED_WIDTH;
        }
        return EditResult.APPLIED;
    }

    /**
     * Swaps in a checked candidate together with its selection, then notifies.
     */
    private void commit(TextBuffer newText, int selStart, int selEnd) {
        int oldCaret = selection.getCaret();
        boolean textChanged = !newText.equals(text);

        text = newText;
        selection.set(selStart, selEnd);
        if (textChanged) {
            projector.update(text, passwordChar);
            modificationStamp++;
        }
        updateScroll();

        if (textChanged) {
            String current = getText();
            for (EditBoxListener listener : listeners) {
                listener.textChanged(current);
            }
        }
        if (selection.getCaret() != oldCaret) {
            int caret = selection.getCaret();
            for (EditBoxListener listener : listeners) {
                listener.caretPositionChanged(caret);
            }
        }
    }

    private void commitSelection(int selStart, int selEnd) {
        commit(text, selStart, selEnd);
    }

    private void updateScroll() {
        scrollWindow.update(projector, selection.getCaret(), getVisibleWidth(), limitWidth);
    }

    /**
     * Re-runs the text through {@link #setText(String)} when a changed constraint means it no longer fits.
     */
    private void reapplyIfOverflowing() {
        boolean tooLong = maxChars > 0 && text.length() > maxChars;
        boolean tooWide = limitWidth && projector.getTotalWidth() > getVisibleWidth();
        if (tooLong || tooWide) {
            setText(getText());
        }
    }

    private static void logRejected(String action, EditResult result) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("edit action=" + action + " result=" + result);
        }
    }

    private static boolean isPrintable(int codePoint) {
        return Character.isValidCodePoint(codePoint)
                && !Character.isISOControl(codePoint)
                && Character.getType(codePoint) != Character.SURROGATE;
    }

    private static int clamp(int index, int length) {
        return Math.max(0, Math.min(index, length));
    }
}
