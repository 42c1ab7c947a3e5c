package net.checkin.adapter.http.notify;

final class Messages {
    private Messages() {}

    /** Title, blank line, body. Either part may be empty. */
    static String combine(String title, String body) {
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isBlank()) sb.append(title).append("\n\n");
        sb.append(body != null ? body : "");
        return sb.toString();
    }
}
