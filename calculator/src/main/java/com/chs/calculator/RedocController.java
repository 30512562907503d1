package com.chs.calculator;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Renders the OpenAPI document with ReDoc, next to the Swagger UI that springdoc serves.
 */
@RestController
public class RedocController {

    private final String page;

    public RedocController(@Value("${springdoc.api-docs.path}") String apiDocsPath,
                           @Value("${calculator.docs.redoc-script}") String redocScript) {
        this.page = "<!DOCTYPE html>\n"
                + "<html>\n"
                + "<head>\n"
                + "  <title>API reference</title>\n"
                + "  <meta charset=\"utf-8\"/>\n"
                + "</head>\n"
                + "<body>\n"
                + "  <redoc spec-url=\"" + apiDocsPath + "\"></redoc>\n"
                + "  <script src=\"" + redocScript + "\"></script>\n"
                + "</body>\n"
                + "</html>\n";
    }

    @GetMapping(value = "/redoc", produces = MediaType.TEXT_HTML_VALUE)
    public String redoc() {
        return page;
    }
}
