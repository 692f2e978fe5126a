package com.flagship.donation_pipeline.notification;

import com.flagship.donation_pipeline.config.DonationProperties;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.support.BestEffortResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sends the donor a plain-text receipt after a donation is recorded.
 *
 * Mail is optional: without {@code spring.mail.host} there is no
 * {@link JavaMailSender} bean and receipts are skipped.
 */
@Component
@Slf4j
public class DonationReceiptNotifier {

    private final Optional<JavaMailSender> mailSender;
    private final DonationProperties.Receipts settings;

    public DonationReceiptNotifier(Optional<JavaMailSender> mailSender, DonationProperties properties) {
        this.mailSender = mailSender;
        this.settings = properties.getReceipts();
    }

    public BestEffortResult sendReceipt(Donation donation) {
        if (mailSender.isEmpty()) {
            return BestEffortResult.skipped("send receipt", "mail is not configured");
        }
        if (donation.getDonorEmail() == null) {
            return BestEffortResult.skipped("send receipt", "no donor email for donation " + donation.getId());
        }
        return BestEffortResult.attempt("send receipt", () -> {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(settings.getFrom());
            message.setTo(donation.getDonorEmail());
            message.setSubject(settings.getSubject());
            message.setText(body(donation));
            mailSender.get().send(message);
            log.info("Receipt sent: donationId={}, receiptNumber={}", donation.getId(), donation.getReceiptNumber());
        });
    }

    private static String body(Donation donation) {
        StringBuilder text = new StringBuilder()
                .append("Dear ").append(donation.getDonorName()).append(",\n\n")
                .append("Thank you for your donation of ")
                .append(donation.getAmount().toPlainString()).append(' ').append(donation.getCurrency())
                .append(" towards ").append(donation.getPurpose()).append(".\n\n");
        if (donation.getReceiptNumber() != null) {
            text.append("Receipt number: ").append(donation.getReceiptNumber()).append('\n');
        }
        if (donation.getTransactionId() != null) {
            text.append("Transaction id: ").append(donation.getTransactionId()).append('\n');
        }
        text.append("Date: ").append(donation.getDonationDate()).append("\n\n")
                .append("With gratitude,\nThe Temple Committee\n");
        return text.toString();
    }
}
