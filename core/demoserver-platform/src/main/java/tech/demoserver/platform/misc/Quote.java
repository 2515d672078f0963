package tech.demoserver.platform.misc;

import java.util.List;

public record Quote(String quote, String author, List<String> tags) {

    /** Served when the quote service answers with a non-200 status. */
    static final Quote UNAVAILABLE = new Quote(
        "The only way to do great work is to love what you do.",
        "Steve Jobs",
        List.of("motivational")
    );

    /** Served when the quote service can not be reached or returns garbage. */
    static final Quote FAILED = new Quote(
        "Success is not final, failure is not fatal: it is the courage to continue that counts.",
        "Winston Churchill",
        List.of("inspirational")
    );
}
