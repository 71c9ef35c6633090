package io.feydor.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

public class FileIo {

    public static Map<String, Object> getJsonStringMapFromResources(String filePath) {
        try (InputStream inputStream = FileIo.class.getResourceAsStream("/" + filePath)) {
            if (inputStream == null) {
                throw new FileNotFoundException("Resource not found on the classpath: " + filePath);
            }
            return getJsonStringMap(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Map<String, Object> getJsonStringMap(File file) {
        try (InputStream inputStream = new FileInputStream(file)) {
            return getJsonStringMap(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Map<String, Object> getJsonStringMap(InputStream inputStream) throws IOException {
        try (InputStreamReader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            TypeToken<Map<String, Object>> typeToken = new TypeToken<>() {};
            Gson gson = new GsonBuilder()
                    .enableComplexMapKeySerialization()
                    .create();
            return gson.fromJson(reader, typeToken);
        }
    }

    public static String toPrettyJson(Object object) {
        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .create();
        return gson.toJson(object);
    }

    public static String readString(File file) throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    public static void writeString(File file, String contents) throws IOException {
        Files.writeString(file.toPath(), contents, StandardCharsets.UTF_8);
    }
}
