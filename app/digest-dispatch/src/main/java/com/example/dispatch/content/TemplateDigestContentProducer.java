/*
 * どこで: Digest Dispatch 本文生成
 * 何を: 受信者名・事業名・購読トピックからテキスト/HTML 本文を組み立てる
 * なぜ: 送信層へ渡す本文形式を一箇所で固定するため
 */
package com.example.dispatch.content;

import com.example.dispatch.recipient.Recipient;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
public class TemplateDigestContentProducer implements DigestContentProducer {

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("EEEE, MMMM d", Locale.US);
  private static final String DEFAULT_NAME = "there";

  @Override
  public DigestContent produce(Recipient recipient, LocalDate deliveryDay) {
    if (recipient == null || deliveryDay == null) {
      throw new ContentProductionException("recipient and delivery day are required");
    }
    final String name = resolveName(recipient);
    final String date = DATE_FORMAT.format(deliveryDay);
    final String subject =
        recipient.businessName() == null
            ? name + ", your daily digest for " + date
            : name + ", your daily digest for " + recipient.businessName() + " - " + date;
    return new DigestContent(
        subject, textBody(name, date, recipient), htmlBody(name, date, recipient));
  }

  private String textBody(String name, String date, Recipient recipient) {
    final StringBuilder text = new StringBuilder();
    text.append("Hi ").append(name).append(",\n\n");
    text.append("Here is your digest for ").append(date).append(".\n");
    final List<String> topics = recipient.contentPreferences();
    if (topics.isEmpty()) {
      text.append("\nYou have not picked any topics yet. Update your digest settings to choose some.\n");
    } else {
      text.append("\nTopics you follow:\n");
      for (String topic : topics) {
        text.append("- ").append(topic).append('\n');
      }
    }
    return text.toString();
  }

  private String htmlBody(String name, String date, Recipient recipient) {
    final StringBuilder html = new StringBuilder();
    html.append("<p>Hi ").append(HtmlUtils.htmlEscape(name)).append(",</p>");
    html.append("<p>Here is your digest for ").append(HtmlUtils.htmlEscape(date)).append(".</p>");
    final List<String> topics = recipient.contentPreferences();
    if (topics.isEmpty()) {
      html.append(
          "<p>You have not picked any topics yet. Update your digest settings to choose some.</p>");
    } else {
      html.append("<ul>");
      for (String topic : topics) {
        html.append("<li>").append(HtmlUtils.htmlEscape(topic)).append("</li>");
      }
      html.append("</ul>");
    }
    return html.toString();
  }

  private String resolveName(Recipient recipient) {
    if (recipient.displayName() != null) {
      return recipient.displayName();
    }
    final String address = recipient.contactAddress();
    if (address != null && address.contains("@")) {
      return address.substring(0, address.indexOf('@'));
    }
    return DEFAULT_NAME;
  }
}
