package com.example.autocount.exception;

public class TemplateTooLargeException extends VisualSearchException {

    public TemplateTooLargeException(int templateWidth, int templateHeight, int imageWidth, int imageHeight) {
        super(ErrorType.TEMPLATE_TOO_LARGE, String.format("Template (%dx%d) is larger than image (%dx%d)",
                templateWidth, templateHeight, imageWidth, imageHeight));
    }
}
