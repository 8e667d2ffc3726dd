package ir.ipaam.docrender.application.util;

public final class FileNameUtils {

    public static final String UNTITLED = "Untitled_Document";

    private FileNameUtils() {
    }

    /** {@code "Q3 report!"} becomes {@code "Q3_report_.pdf"}; a blank title gives {@code Untitled_Document.pdf}. */
    public static String pdfFileName(String title) {
        if (title == null || title.isBlank()) return UNTITLED + ".pdf";
        return title.replaceAll("[^A-Za-z0-9]", "_") + ".pdf";
    }
}
