package com.example.dispatch.content;

public record DigestContent(String subject, String textBody, String htmlBody) {}
