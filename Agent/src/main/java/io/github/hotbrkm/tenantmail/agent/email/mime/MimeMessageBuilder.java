package io.github.hotbrkm.tenantmail.agent.email.mime;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import lombok.Getter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Builds one outgoing message. Header values are set explicitly; Jakarta Mail only contributes the
 * multipart structure and transfer encoding.
 */
@Getter
class MimeMessageBuilder {

    private static final String CRLF = "\r\n";
    private static final DateTimeFormatter RFC_2822_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);
    private static final String ENC_BASE64 = "base64";
    private static final String CHARSET = "UTF-8";

    private final MimeMessage mimeMessage;
    private final MimeMultipart alternativeContent;

    private String from;
    private String to;
    private String subject;
    private String messageId;
    private int bodyPartCount;
    private String singleSubtype;
    private String singleContent;
    private String extensionHeader;

    MimeMessageBuilder() {
        mimeMessage = new MimeMessage(Session.getInstance(new Properties()));
        alternativeContent = new MimeMultipart("alternative");
    }

    public void setFrom(String email) {
        from = email.trim();
    }

    public void setTo(List<String> recipients) {
        to = String.join(", ", recipients.stream().map(String::trim).toList());
    }

    public void setSubject(String subject) {
        String value = subject == null ? "" : subject.trim();
        try {
            this.subject = MimeUtility.fold(9, MimeUtility.encodeText(value, CHARSET, "B"));
        } catch (IOException ex) {
            this.subject = "";
        }
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    /**
     * Adds a body alternative. Text parts must be added before HTML parts so that clients prefer the HTML.
     */
    public void addAlterContent(String contentType, String content) throws MessagingException {
        MimeBodyPart bodyPart = new MimeBodyPart();
        bodyPart.setText(content, CHARSET, getSubtype(contentType));
        bodyPart.setHeader("Content-Transfer-Encoding", ENC_BASE64);
        alternativeContent.addBodyPart(bodyPart);
        bodyPartCount++;
        singleSubtype = getSubtype(contentType);
        singleContent = content;
    }

    private String getSubtype(String contentType) {
        int slashIndex = contentType.indexOf('/');
        if (slashIndex != -1 && slashIndex < contentType.length() - 1) {
            return contentType.substring(slashIndex + 1);
        }
        return "html";
    }

    public void makeHeader(ZonedDateTime date, Map<String, String> customHeader) throws MessagingException {
        mimeMessage.setHeader("From", from);
        mimeMessage.setHeader("To", to);
        mimeMessage.setHeader("Subject", subject);
        mimeMessage.setHeader("Date", date.format(RFC_2822_FORMATTER));
        mimeMessage.setHeader("MIME-Version", "1.0");

        for (Map.Entry<String, String> entry : customHeader.entrySet()) {
            mimeMessage.setHeader(entry.getKey(), entry.getValue());
        }
    }

    public void makeBody() throws MessagingException {
        if (bodyPartCount > 1) {
            mimeMessage.setContent(alternativeContent);
        } else if (bodyPartCount == 1) {
            mimeMessage.setText(singleContent, CHARSET, singleSubtype);
            mimeMessage.setHeader("Content-Transfer-Encoding", ENC_BASE64);
        } else {
            mimeMessage.setText("", CHARSET);
        }
        mimeMessage.saveChanges();
        // saveChanges assigns its own Message-ID.
        mimeMessage.setHeader("Message-ID", messageId);
    }

    public void setExtension(String headerLine) {
        this.extensionHeader = headerLine;
    }

    /**
     * Returns the MIME header and body as a String, prefixed by the extension header when one is set.
     */
    public String toString() {
        try {
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            mimeMessage.writeTo(outputStream);
            String result = outputStream.toString(StandardCharsets.UTF_8);

            if (extensionHeader != null) {
                return extensionHeader + CRLF + result;
            }
            return result;
        } catch (IOException | MessagingException e) {
            throw new IllegalStateException("Failed to convert MimeMessage to String", e);
        }
    }
}
