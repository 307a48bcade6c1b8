package com.example.orchestrator.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.domain.StaffRole;
import com.example.orchestrator.identity.IdentityResolution;
import com.example.orchestrator.identity.IdentityResolver;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntentClassifierTest {

    private static final String TENANT = "tenant-1";
    private static final String PHONE = "6281234567890";

    @Mock
    private IdentityResolver identityResolver;

    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(identityResolver);
    }

    @Test
    @DisplayName("'sales report' from an admin is a staff report request")
    void salesReportFromAdmin() {
        when(identityResolver.resolve(TENANT, "081234567890")).thenReturn(staff(StaffRole.ADMIN));

        ClassificationResult result = classifier.classify(
                "sales report", "081234567890", TENANT, false, false, ConversationStatus.ACTIVE);

        assertThat(result.intent()).isEqualTo(MessageIntent.STAFF_GET_REPORT);
        assertThat(result.isStaff()).isTrue();
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"tidak, terima kasih", "Terima kasih banyak", "makasih ya", "no thanks", "sudah cukup", "Tidak"})
    void closingPhrasesCloseEscalatedConversations(String text) {
        ClassificationResult result = classify(text, customer(), false, ConversationStatus.ESCALATED);

        assertThat(result.intent()).isEqualTo(MessageIntent.CLOSE_CONVERSATION);
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @EnumSource(value = ConversationStatus.class, names = {"ACTIVE", "CLOSED"})
    @DisplayName("Closing phrases outside an escalation are plain acknowledgements")
    void closingPhraseOutsideEscalation(ConversationStatus status) {
        ClassificationResult result = classify("tidak, terima kasih", customer(), false, status);

        assertThat(result.intent()).isEqualTo(MessageIntent.CUSTOMER_ACKNOWLEDGEMENT);
        assertThat(result.isStaff()).isFalse();
    }

    @Test
    void thanksFollowedByQuestionIsStillAnInquiry() {
        ClassificationResult result = classify(
                "makasih, harga avanza 2020 berapa?", customer(), false, ConversationStatus.ACTIVE);

        assertThat(result.intent()).isEqualTo(MessageIntent.CUSTOMER_PRICE_INQUIRY);
    }

    @Test
    void customerCannotTriggerStaffCommands() {
        ClassificationResult result = classify("sales report", customer(), false, ConversationStatus.ACTIVE);

        assertThat(result.intent().isStaffCommand()).isFalse();
        assertThat(result.isStaff()).isFalse();
    }

    @Test
    @DisplayName("Explicit staff context outranks an unresolved identity")
    void explicitStaffContextWins() {
        ClassificationResult result = classify("stok brio", customer(), true, ConversationStatus.ACTIVE);

        assertThat(result.intent()).isEqualTo(MessageIntent.STAFF_CHECK_INVENTORY);
        assertThat(result.isStaff()).isTrue();
    }

    @Test
    void explicitStaffContextKeepsStaffFlagOnChatter() {
        ClassificationResult result = classify("halo", customer(), true, ConversationStatus.ACTIVE);

        assertThat(result.isStaff()).isTrue();
        assertThat(result.intent()).isEqualTo(MessageIntent.CUSTOMER_GREETING);
    }

    @Test
    void ambiguousIdentityIsNotStaff() {
        IdentityResolution ambiguous = IdentityResolution.of(List.of(
                identity("s1", StaffRole.OWNER), identity("s2", StaffRole.SALES)), PHONE);

        ClassificationResult result = classify("sales report", ambiguous, false, ConversationStatus.ACTIVE);

        assertThat(result.isStaff()).isFalse();
        assertThat(result.intent().isStaffCommand()).isFalse();
    }

    @Test
    void staffCommandConfidenceFollowsSpecificity() {
        IdentityResolution sales = staff(StaffRole.SALES);

        assertThat(classify("/status PM-PST-001 SOLD", sales, false, ConversationStatus.ACTIVE))
                .extracting(ClassificationResult::intent, ClassificationResult::confidence)
                .containsExactly(MessageIntent.STAFF_UPDATE_STATUS, 0.95);
        assertThat(classify("tolong update status PM-PST-001 jadi sold", sales, false, ConversationStatus.ACTIVE))
                .extracting(ClassificationResult::intent, ClassificationResult::confidence)
                .containsExactly(MessageIntent.STAFF_UPDATE_STATUS, 0.85);
        assertThat(classify("minta penjualan summary dong", staff(StaffRole.OWNER), false, ConversationStatus.ACTIVE))
                .extracting(ClassificationResult::intent, ClassificationResult::confidence)
                .containsExactly(MessageIntent.STAFF_GET_REPORT, 0.8);
    }

    @Test
    void staffPhotoWithoutCaptionIsUpload() {
        ClassificationResult result = classifier.classify(
                new ClassificationRequest("", PHONE, TENANT, true, false, ConversationStatus.ACTIVE),
                staff(StaffRole.SALES));

        assertThat(result.intent()).isEqualTo(MessageIntent.STAFF_UPLOAD_VEHICLE);
        assertThat(result.confidence()).isEqualTo(0.9);
    }

    @Test
    void vehicleDescriptionFromStaffIsUpload() {
        ClassificationResult result = classify(
                "Toyota Avanza 2019 manual 150jt km 40rb", staff(StaffRole.SALES), false, ConversationStatus.ACTIVE);

        assertThat(result.intent()).isEqualTo(MessageIntent.STAFF_UPLOAD_VEHICLE);
    }

    @Test
    void verifyIsRecognizedForAnySender() {
        ClassificationResult result = classify("/verify 081234567890", customer(), false, ConversationStatus.ACTIVE);

        assertThat(result.intent()).isEqualTo(MessageIntent.STAFF_VERIFY_IDENTITY);
        assertThat(result.isStaff()).isFalse();
    }

    @Test
    void customerPatterns() {
        assertThat(classify("Halo kak", customer(), false, null).intent()).isEqualTo(MessageIntent.CUSTOMER_GREETING);
        assertThat(classify("halo, berapa harga brio?", customer(), false, null).intent())
                .isEqualTo(MessageIntent.CUSTOMER_PRICE_INQUIRY);
        assertThat(classify("bisa test drive sabtu?", customer(), false, null).intent())
                .isEqualTo(MessageIntent.CUSTOMER_TEST_DRIVE);
    }

    @Test
    void fallbackIntents() {
        ClassificationResult inquiry = classify("apakah bisa dikirim ke surabaya", customer(), false, null);
        ClassificationResult blank = classify("   ", customer(), false, null);

        assertThat(inquiry.intent()).isEqualTo(MessageIntent.CUSTOMER_INQUIRY);
        assertThat(inquiry.confidence()).isEqualTo(IntentClassifier.FALLBACK_CONFIDENCE);
        assertThat(blank.intent()).isEqualTo(MessageIntent.UNKNOWN);
        assertThat(blank.confidence()).isZero();
    }

    @Test
    void wireNamesAreSnakeCase() {
        assertThat(MessageIntent.STAFF_GET_REPORT.wireName()).isEqualTo("staff_get_report");
        assertThat(MessageIntent.CLOSE_CONVERSATION.wireName()).isEqualTo("close_conversation");
    }

    private ClassificationResult classify(
            String text, IdentityResolution identity, boolean explicitStaff, ConversationStatus status) {
        return classifier.classify(new ClassificationRequest(text, PHONE, TENANT, false, explicitStaff, status), identity);
    }

    private static IdentityResolution customer() {
        return IdentityResolution.none(PHONE);
    }

    private static IdentityResolution staff(StaffRole role) {
        return IdentityResolution.of(List.of(identity("s1", role)), PHONE);
    }

    private static StaffIdentity identity(String id, StaffRole role) {
        return StaffIdentity.builder().id(id).tenantId(TENANT).phone(PHONE).role(role).build();
    }
}
