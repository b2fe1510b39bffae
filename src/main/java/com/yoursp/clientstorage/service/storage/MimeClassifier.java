package com.yoursp.clientstorage.service.storage;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps file names to MIME types and to the coarse categories used by the
 * statistics endpoint. Lookup is by lower-cased extension only; file contents
 * are never inspected.
 */
@Component
public class MimeClassifier {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    public static final String IMAGES = "Images";
    public static final String VIDEOS = "Videos";
    public static final String AUDIO = "Audio";
    public static final String PDF = "PDF";
    public static final String DOCUMENTS = "Documents";
    public static final String SPREADSHEETS = "Spreadsheets";
    public static final String PRESENTATIONS = "Presentations";
    public static final String ARCHIVES = "Archives";
    public static final String TEXT = "Text";
    public static final String OTHER = "Other";

    private static final Map<String, String> MIME_TYPES = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("ico", "image/x-icon"),
            Map.entry("tif", "image/tiff"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("heic", "image/heic"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("webm", "video/webm"),
            Map.entry("wmv", "video/x-ms-wmv"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("flac", "audio/flac"),
            Map.entry("aac", "audio/aac"),
            Map.entry("m4a", "audio/mp4"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("odt", "application/vnd.oasis.opendocument.text"),
            Map.entry("rtf", "application/rtf"),
            Map.entry("xls", "application/vnd.ms-excel"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
            Map.entry("ods", "application/vnd.oasis.opendocument.spreadsheet"),
            Map.entry("csv", "text/csv"),
            Map.entry("ppt", "application/vnd.ms-powerpoint"),
            Map.entry("pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
            Map.entry("odp", "application/vnd.oasis.opendocument.presentation"),
            Map.entry("zip", "application/zip"),
            Map.entry("rar", "application/vnd.rar"),
            Map.entry("7z", "application/x-7z-compressed"),
            Map.entry("tar", "application/x-tar"),
            Map.entry("gz", "application/gzip"),
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("log", "text/plain"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("js", "text/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("yaml", "application/yaml"),
            Map.entry("yml", "application/yaml"));

    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of("doc", "docx", "odt", "rtf");
    private static final Set<String> SPREADSHEET_EXTENSIONS = Set.of("xls", "xlsx", "ods", "csv");
    private static final Set<String> PRESENTATION_EXTENSIONS = Set.of("ppt", "pptx", "odp");
    private static final Set<String> ARCHIVE_EXTENSIONS = Set.of("zip", "rar", "7z", "tar", "gz");
    private static final Set<String> TEXT_EXTENSIONS = Set.of(
            "txt", "md", "log", "html", "htm", "css", "js", "json", "xml", "yaml", "yml");

    public String mimeTypeOf(String filename) {
        return MIME_TYPES.getOrDefault(extensionOf(filename), DEFAULT_MIME_TYPE);
    }

    public String categoryOf(String filename) {
        String ext = extensionOf(filename);
        if ("pdf".equals(ext)) {
            return PDF;
        }
        if (DOCUMENT_EXTENSIONS.contains(ext)) {
            return DOCUMENTS;
        }
        if (SPREADSHEET_EXTENSIONS.contains(ext)) {
            return SPREADSHEETS;
        }
        if (PRESENTATION_EXTENSIONS.contains(ext)) {
            return PRESENTATIONS;
        }
        if (ARCHIVE_EXTENSIONS.contains(ext)) {
            return ARCHIVES;
        }
        if (TEXT_EXTENSIONS.contains(ext)) {
            return TEXT;
        }

        String mime = MIME_TYPES.get(ext);
        if (mime == null) {
            return OTHER;
        }
        if (mime.startsWith("image/")) {
            return IMAGES;
        }
        if (mime.startsWith("video/")) {
            return VIDEOS;
        }
        if (mime.startsWith("audio/")) {
            return AUDIO;
        }
        return OTHER;
    }

    /**
     * Lower-cased extension without the dot, or an empty string. Dot-files
     * such as {@code .env} have no extension.
     */
    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot <= slash + 1 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
