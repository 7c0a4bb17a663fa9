package dev.agentpanel.core.config;

import dev.agentpanel.core.api.ApCoreError;
import dev.agentpanel.core.api.ApCoreException;
import dev.agentpanel.core.fs.FileSystem;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Targeted edit of {@code autoStartAtLogin} under {@code [app]} that leaves every other line,
 * comment and indentation of config.toml untouched.
 */
public final class ConfigWriteBack {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigWriteBack.class);
    private static final String KEY = "autoStartAtLogin";
    private static final Pattern APP_HEADER = Pattern.compile("\\[\\s*app\\s*]");

    private ConfigWriteBack() {}

    /**
     * @throws ApCoreException with {@code fileSystem} category when the file cannot be read, decoded or written
     */
    public static void setAutoStartAtLogin(boolean value, Path path, FileSystem fileSystem) {
        String content;
        try {
            content = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(fileSystem.readBytes(path)))
                .toString();
        } catch (CharacterCodingException ex) {
            throw new ApCoreException(ApCoreError.fileSystem("Config file is not valid UTF-8", path.toString()), ex);
        } catch (IOException ex) {
            throw new ApCoreException(ApCoreError.fileSystem("Failed to read config at " + path, ex.getMessage()), ex);
        }

        String updated = updateAutoStartAtLogin(content, value);
        try {
            fileSystem.writeBytes(path, updated.getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ApCoreException(ApCoreError.fileSystem("Failed to write config at " + path, ex.getMessage()), ex);
        }
        LOG.info("Set app.autoStartAtLogin = {} in {}", value, path);
    }

    /**
     * Rewrites the existing key, inserts it right after {@code [app]}, or appends a new
     * {@code [app]} section at the end of the file. CRLF files stay CRLF.
     */
    public static String updateAutoStartAtLogin(String content, boolean value) {
        String literal = Boolean.toString(value);
        String separator = content.contains("\r\n") ? "\r\n" : "\n";
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\r?\n", -1)));

        int sectionStart = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (APP_HEADER.matcher(stripComment(lines.get(i))).matches()) {
                sectionStart = i;
                break;
            }
        }

        if (sectionStart >= 0) {
            int keyIndex = -1;
            for (int i = sectionStart + 1; i < lines.size(); i++) {
                String trimmed = lines.get(i).strip();
                if (trimmed.startsWith("[")) {
                    break;
                }
                if (isKeyLine(trimmed)) {
                    keyIndex = i;
                    break;
                }
            }
            if (keyIndex >= 0) {
                lines.set(keyIndex, rewriteKeyLine(lines.get(keyIndex), literal));
            } else {
                lines.add(sectionStart + 1, KEY + " = " + literal);
            }
        } else {
            String last = lines.get(lines.size() - 1);
            if (!last.isBlank()) {
                lines.add("");
            }
            lines.add("[app]");
            lines.add(KEY + " = " + literal);
        }
        return String.join(separator, lines);
    }

    private static String stripComment(String line) {
        String trimmed = line.strip();
        int hash = trimmed.indexOf('#');
        return hash >= 0 ? trimmed.substring(0, hash).strip() : trimmed;
    }

    private static boolean isKeyLine(String trimmed) {
        if (!trimmed.startsWith(KEY)) {
            return false;
        }
        if (trimmed.length() == KEY.length()) {
            return true;
        }
        char next = trimmed.charAt(KEY.length());
        return Character.isWhitespace(next) || next == '=';
    }

    private static String rewriteKeyLine(String original, String literal) {
        int indentEnd = 0;
        while (indentEnd < original.length() && (original.charAt(indentEnd) == ' ' || original.charAt(indentEnd) == '\t')) {
            indentEnd++;
        }
        String comment = "";
        int hash = original.indexOf('#');
        if (hash >= 0) {
            int commentStart = hash;
            while (commentStart > 0 && Character.isWhitespace(original.charAt(commentStart - 1))) {
                commentStart--;
            }
            comment = original.substring(commentStart);
        }
        return original.substring(0, indentEnd) + KEY + " = " + literal + comment;
    }
}
