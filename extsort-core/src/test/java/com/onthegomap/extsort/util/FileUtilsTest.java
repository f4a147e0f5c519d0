package com.onthegomap.extsort.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

  @TempDir
  Path tmpDir;

  @Test
  void testCreateAndDeleteFileInNestedDirectory() throws IOException {
    Path parent = tmpDir.resolve(Path.of("a", "b", "c"));
    Path file = parent.resolve("0");
    FileUtils.createDirectory(parent);
    Files.write(file, new byte[]{1, 2, 3});
    assertEquals(3, FileUtils.fileSize(file));

    FileUtils.delete(tmpDir.resolve("a"));
    assertFalse(Files.exists(file));
    assertFalse(Files.exists(parent));
    assertFalse(Files.exists(tmpDir.resolve("a")));
    assertEquals(0, FileUtils.fileSize(file));
  }

  @Test
  void testDeleteSortDirectoryWithSegments() throws IOException {
    Path dir = tmpDir.resolve("sort");
    FileUtils.createDirectory(dir);
    Files.write(dir.resolve("0"), new byte[10]);
    Files.write(dir.resolve("1"), new byte[5]);
    assertEquals(10, FileUtils.fileSize(dir.resolve("0")));
    FileUtils.deleteDirectory(dir);
    assertFalse(Files.exists(dir));
    assertTrue(Files.exists(tmpDir));
  }

  @Test
  void testDeleteMissingFilesIsNoop() {
    Path missing = tmpDir.resolve("missing");
    FileUtils.deleteFile(missing);
    FileUtils.deleteDirectory(missing);
    FileUtils.delete(missing);
    assertFalse(Files.exists(missing));
    assertTrue(Files.exists(tmpDir));
  }

  @Test
  void testCreateExistingDirectory() throws IOException {
    FileUtils.createDirectory(tmpDir);
    assertTrue(Files.isDirectory(tmpDir));
  }
}
