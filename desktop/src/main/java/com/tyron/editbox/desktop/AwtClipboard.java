package com.tyron.editbox.desktop;

import com.tyron.editbox.api.editor.Clipboard;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.awt.Toolkit;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Clipboard} backed by an AWT clipboard, usually the system one.
 *
 * An {@link IllegalStateException} from a clipboard that is busy is not caught here; the edit
 * session logs it and drops the copy or paste.
 */
public final class AwtClipboard implements Clipboard {

    private static final Logger LOG = Logger.getLogger(AwtClipboard.class.getName());

    private final java.awt.datatransfer.Clipboard clipboard;

    public AwtClipboard(@NotNull java.awt.datatransfer.Clipboard clipboard) {
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
    }

    public static AwtClipboard system() {
        return new AwtClipboard(Toolkit.getDefaultToolkit().getSystemClipboard());
    }

    @Nullable
    @Override
    public String getContents() {
        if (!clipboard.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
            return null;
        }
        try {
            return (String) clipboard.getData(DataFlavor.stringFlavor);
        } catch (UnsupportedFlavorException | IOException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "clipboard action=read result=noText name=" + clipboard.getName(), e);
            }
            return null;
        }
    }

    @Override
    public void setContents(@NotNull String text) {
        StringSelection selection = new StringSelection(Objects.requireNonNull(text, "text"));
        clipboard.setContents(selection, selection);
    }
}
