package me.golemcore.calhelper.adapter.outbound.storage;

import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        CalHelperProperties properties = new CalHelperProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesBaseDirectory() {
        assertTrue(Files.isDirectory(tempDir));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "test-file.txt", "Hello, World!", false).get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "test-file.txt").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void exists_reflectsFileState() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(TEST_DIR, "existing.txt").get());

        storageAdapter.putTextAtomic(TEST_DIR, "existing.txt", CONTENT_DEFAULT, false).get();

        assertTrue(storageAdapter.exists(TEST_DIR, "existing.txt").get());
    }

    @Test
    void deleteObject_removesFileAndBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "doc.json", "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "doc.json", "v2", true).get();
        assertTrue(Files.exists(tempDir.resolve(TEST_DIR).resolve("doc.json.bak")));

        storageAdapter.deleteObject(TEST_DIR, "doc.json").get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("doc.json")));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("doc.json.bak")));
    }

    @Test
    void listObjects_skipsTemporaryAndBackupFiles() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "b.json", CONTENT_DEFAULT, false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "a.json", CONTENT_DEFAULT, false).get();
        Files.writeString(tempDir.resolve(TEST_DIR).resolve("a.json.tmp"), "partial");
        Files.writeString(tempDir.resolve(TEST_DIR).resolve("a.json.bak"), "old");

        List<String> files = storageAdapter.listObjects(TEST_DIR, "").get();

        assertEquals(List.of("a.json", "b.json"), files);
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
    }

    @Test
    void putTextAtomic_keepsPreviousVersionAsBackup() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "thread.json", "first", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "thread.json", "second", true).get();

        assertEquals("second", storageAdapter.getText(TEST_DIR, "thread.json").get());
        assertEquals("first", Files.readString(tempDir.resolve(TEST_DIR).resolve("thread.json.bak")));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("thread.json.tmp")));
    }

    @Test
    void putTextAtomic_withoutBackupLeavesNoBackupFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "thread.json", "first", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "thread.json", "second", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("thread.json.bak")));
    }

    @Test
    void ensureDirectory_createsNestedDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("a/b/c").get();

        assertTrue(Files.isDirectory(tempDir.resolve("a/b/c")));
    }

    @Test
    void rejectsPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
