package com.gentoro.morphie.utility;

import com.gentoro.morphie.exception.IoException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtility {

  public static Reader openReader(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new IoException("Error opening file: " + file);
    }
    try {
      return Files.newBufferedReader(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Error opening file: " + file, e);
    }
  }

  public static void writeString(Path file, String contents) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(file, contents, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Error writing to file: " + file, e);
    }
  }
}
