package com.flagship.donation_pipeline.notification;

import com.flagship.donation_pipeline.config.DonationProperties;
import com.flagship.donation_pipeline.donation.Donation;
import com.flagship.donation_pipeline.donation.DonationStatus;
import com.flagship.donation_pipeline.donation.DonationType;
import com.flagship.donation_pipeline.support.BestEffortResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class DonationReceiptNotifierTest {

    private static Donation donation(String email) {
        return Donation.builder()
                .id(UUID.randomUUID())
                .donorName("Meera Iyer")
                .donorEmail(email)
                .amount(new BigDecimal("51.00"))
                .currency("USD")
                .donationType(DonationType.PUJA)
                .status(DonationStatus.COMPLETED)
                .purpose("Puja Sponsorship")
                .transactionId("TXN-R1")
                .receiptNumber("DON-R1")
                .donationDate(LocalDate.of(2024, 6, 1))
                .build();
    }

    @Test
    @DisplayName("Receipt is mailed to the donor with the receipt number")
    void testSendReceipt_Sent() {
        JavaMailSender sender = mock(JavaMailSender.class);
        DonationReceiptNotifier notifier = new DonationReceiptNotifier(Optional.of(sender), new DonationProperties());

        BestEffortResult result = notifier.sendReceipt(donation("meera@example.com"));

        assertTrue(result.isSucceeded());
        ArgumentCaptor<SimpleMailMessage> message = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(sender).send(message.capture());
        assertArrayEquals(new String[]{"meera@example.com"}, message.getValue().getTo());
        assertEquals("Thank you for your donation", message.getValue().getSubject());
        assertTrue(message.getValue().getText().contains("Receipt number: DON-R1"));
        assertTrue(message.getValue().getText().contains("51.00 USD towards Puja Sponsorship"));
    }

    @Test
    @DisplayName("Without mail configuration or donor email the receipt is skipped")
    void testSendReceipt_Skipped() {
        JavaMailSender sender = mock(JavaMailSender.class);

        assertTrue(new DonationReceiptNotifier(Optional.empty(), new DonationProperties())
                .sendReceipt(donation("meera@example.com")).isSucceeded());
        assertTrue(new DonationReceiptNotifier(Optional.of(sender), new DonationProperties())
                .sendReceipt(donation(null)).isSucceeded());
        verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("Mail failure is reported, not thrown")
    void testSendReceipt_Failure() {
        JavaMailSender sender = mock(JavaMailSender.class);
        doThrow(new MailSendException("SMTP down")).when(sender).send(any(SimpleMailMessage.class));
        DonationReceiptNotifier notifier = new DonationReceiptNotifier(Optional.of(sender), new DonationProperties());

        BestEffortResult result = notifier.sendReceipt(donation("meera@example.com"));

        assertFalse(result.isSucceeded());
        assertTrue(result.failure().isPresent());
    }
}
