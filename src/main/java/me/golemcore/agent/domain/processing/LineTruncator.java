package me.golemcore.agent.domain.processing;

/**
 * Cuts every line longer than {@code maxLength} characters and marks the cut
 * with {@code "..."}. Lines are re-joined with {@code \n}.
 */
public class LineTruncator extends TextRewritingTransformer {

    private static final String ELLIPSIS = "...";

    private final int maxLength;

    public LineTruncator(int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    @Override
    protected String rewrite(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String[] lines = text.split("\r?\n", -1);
        int count = lines.length;
        // a trailing newline does not start another line
        if (count > 1 && lines[count - 1].isEmpty()) {
            count--;
        }
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                result.append('\n');
            }
            String line = lines[i];
            if (line.length() > maxLength) {
                result.append(line, 0, maxLength).append(ELLIPSIS);
            } else {
                result.append(line);
            }
        }
        return result.toString();
    }
}
