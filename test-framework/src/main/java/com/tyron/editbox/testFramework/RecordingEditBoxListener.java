package com.tyron.editbox.testFramework;

import com.tyron.editbox.api.editor.EditBoxListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every notification in the order it was received.
 */
public final class RecordingEditBoxListener implements EditBoxListener {

    private final List<String> events = new ArrayList<>();
    private final List<String> texts = new ArrayList<>();
    private final List<Integer> carets = new ArrayList<>();
    private final List<String> returns = new ArrayList<>();
    private final List<String> returnsOrUnfocus = new ArrayList<>();

    @Override
    public void textChanged(String newText) {
        texts.add(newText);
        events.add("text:" + newText);
    }

    @Override
    public void caretPositionChanged(int caretPosition) {
        carets.add(caretPosition);
        events.add("caret:" + caretPosition);
    }

    @Override
    public void returnKeyPressed(String text) {
        returns.add(text);
        events.add("return:" + text);
    }

    @Override
    public void returnOrUnfocused(String text) {
        returnsOrUnfocus.add(text);
        events.add("returnOrUnfocus:" + text);
    }

    /**
     * @return all notifications as {@code kind:value} strings.
     */
    public List<String> getEvents() {
        return events;
    }

    public List<String> getTextChanges() {
        return texts;
    }

    public List<Integer> getCaretChanges() {
        return carets;
    }

    public List<String> getReturnKeyPresses() {
        return returns;
    }

    public List<String> getReturnOrUnfocused() {
        return returnsOrUnfocus;
    }

    public void clear() {
        events.clear();
        texts.clear();
        carets.clear();
        returns.clear();
        returnsOrUnfocus.clear();
    }
}
