package com.myorg.cafe.contracts.core.envelope;
import lombok.*;
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorInfo {
    public static final int MAX_TEXT = 2000;

    private String code;
    private String message;
    private String detail;

    public static ErrorInfo of(String code, String message) {
        return new ErrorInfo(code, truncate(message), null);
    }

    public static ErrorInfo from(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String detail = root == e ? null : root.getClass().getName() + ": " + nullToEmpty(root.getMessage());
        return new ErrorInfo(e.getClass().getName(), truncate(nullToEmpty(e.getMessage())), truncate(detail));
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_TEXT ? s.substring(0, MAX_TEXT) : s;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
