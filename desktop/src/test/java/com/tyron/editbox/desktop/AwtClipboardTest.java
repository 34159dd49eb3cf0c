package com.tyron.editbox.desktop;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.Transferable;
import java.awt.datatransfer.UnsupportedFlavorException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class AwtClipboardTest {

    private Clipboard awt;
    private AwtClipboard clipboard;

    @BeforeEach
    public void setUp() {
        awt = new Clipboard("test");
        clipboard = new AwtClipboard(awt);
    }

    @Test
    public void roundTripsText() {
        clipboard.setContents("hello");

        assertEquals("hello", clipboard.getContents());
    }

    @Test
    public void emptyClipboardHasNoText() {
        assertNull(clipboard.getContents());
    }

    @Test
    public void nonTextContentsAreIgnored() {
        DataFlavor imageFlavor = DataFlavor.imageFlavor;
        awt.setContents(new Transferable() {
            @Override
            public DataFlavor[] getTransferDataFlavors() {
                return new DataFlavor[]{imageFlavor};
            }

            @Override
            public boolean isDataFlavorSupported(DataFlavor flavor) {
                return imageFlavor.equals(flavor);
            }

            @Override
            public Object getTransferData(DataFlavor flavor) throws UnsupportedFlavorException {
                throw new UnsupportedFlavorException(flavor);
            }
        }, null);

        assertNull(clipboard.getContents());
    }
}
