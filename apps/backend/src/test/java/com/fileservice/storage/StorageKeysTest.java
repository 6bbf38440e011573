package com.fileservice.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageKeysTest {

    @Test
    void fileKeyLivesUnderFilesPrefix() {
        assertEquals("files/abc_days.png", StorageKeys.fileKey("abc_days.png"));
    }

    @Test
    void thumbnailKeyIsDerivedFromOriginalKey() {
        assertEquals("thumbnails/abc_days.png.png", StorageKeys.thumbnailKey("files/abc_days.png"));
        assertEquals("thumbnails/photo.jpg.png", StorageKeys.thumbnailKey(StorageKeys.fileKey("photo.jpg")));
    }

    @Test
    void thumbnailsNeverLandUnderFilesPrefix() {
        String key = StorageKeys.thumbnailKey(StorageKeys.fileKey("x.gif"));
        assertTrue(key.startsWith(StorageKeys.THUMBNAILS_PREFIX));
        assertTrue(!key.startsWith(StorageKeys.FILES_PREFIX));
    }
}
