package vn.com.fecredit.uploadpipeline.model.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects filenames that are unsafe to use as a storage name.
 */
public final class FileNameValidator {

    public static final int MAX_LENGTH = 255;

    private static final List<Pattern> UNSAFE_PATTERNS = List.of(
            Pattern.compile("\\A\\s*\\z"),
            Pattern.compile("\\A\\.+\\z"),
            Pattern.compile("\\.\\."),
            Pattern.compile("[<>:\"|*?]"),
            Pattern.compile("[/\\\\\\x00]"),
            Pattern.compile("\\A(CON|PRN|AUX|NUL|COM[1-9]|LPT[1-9])(\\.|\\z)", Pattern.CASE_INSENSITIVE)
    );

    private FileNameValidator() {
    }

    public static boolean isValidFileName(String fileName) {
        return validate(fileName) == null;
    }

    /**
     * @return the reason the filename is rejected, or {@code null} when it is acceptable
     */
    public static String validate(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return "filename is required";
        }
        if (fileName.length() > MAX_LENGTH) {
            return "filename is too long (maximum " + MAX_LENGTH + " characters)";
        }
        for (Pattern pattern : UNSAFE_PATTERNS) {
            if (pattern.matcher(fileName).find()) {
                return "filename contains unsafe characters or patterns";
            }
        }
        return null;
    }
}
