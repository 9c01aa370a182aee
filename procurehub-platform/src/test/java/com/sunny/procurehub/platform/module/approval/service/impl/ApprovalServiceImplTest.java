package com.sunny.procurehub.platform.module.approval.service.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.procurehub.common.exception.ConflictException;
import com.sunny.procurehub.platform.config.ApprovalProperties;
import com.sunny.procurehub.platform.exception.approval.ApprovalForbiddenException;
import com.sunny.procurehub.platform.exception.approval.InvalidTransitionException;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.approval.dto.ApprovalDto;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalEvent;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRequest;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalStatus;
import com.sunny.procurehub.platform.module.approval.enums.RequestType;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalEventMapper;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalRequestMapper;
import com.sunny.procurehub.platform.module.approval.model.ApprovalActor;
import com.sunny.procurehub.platform.module.approval.model.RoutedRule;
import com.sunny.procurehub.platform.module.approval.service.ApprovalRuleResolver;
import com.sunny.procurehub.platform.module.ledger.dto.LedgerDto;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import com.sunny.procurehub.platform.module.ledger.enums.HoldStatus;
import com.sunny.procurehub.platform.module.ledger.service.CreditLedgerService;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApprovalServiceImplTest {

    private static final Long COMPANY_ID = 1L;
    private static final Long REQUEST_ID = 7L;
    private static final Long REQUESTER_ID = 5L;
    private static final Long APPROVER_ID = 9L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 8, 0);

    private static final ApprovalActor REQUESTER =
            new ApprovalActor(REQUESTER_ID, COMPANY_ID, null, OrgRole.MEMBER, false);
    private static final ApprovalActor APPROVER =
            new ApprovalActor(APPROVER_ID, COMPANY_ID, null, OrgRole.APPROVER, false);

    @Mock
    private ApprovalRequestMapper approvalRequestMapper;
    @Mock
    private ApprovalEventMapper approvalEventMapper;
    @Mock
    private ApprovalRuleResolver approvalRuleResolver;
    @Mock
    private CreditLedgerService creditLedgerService;
    @Mock
    private OrganizationService organizationService;
    @Mock
    private TransactionExecutor transactionExecutor;

    private ApprovalServiceImpl approvalService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
        approvalService = new ApprovalServiceImpl(approvalRequestMapper, approvalEventMapper, approvalRuleResolver,
                creditLedgerService, organizationService, transactionExecutor, new ApprovalProperties(),
                new ObjectMapper(), clock);
        lenient().when(transactionExecutor.execute(any(DbScene.class), any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
    }

    @Test
    void submit_shouldHoldAndAutoApproveSmallRequest() {
        ApprovalRequest request = request(ApprovalStatus.DRAFT, 300L);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(approvalRuleResolver.resolve(COMPANY_ID, 300L))
                .thenReturn(new RoutedRule(null, ApprovalLevel.AUTO, null, null));
        when(creditLedgerService.findAccountByCompany(COMPANY_ID)).thenReturn(Optional.of(account()));
        when(creditLedgerService.placeHold(10L, REQUEST_ID, 300L, "request:submit:7", REQUESTER_ID))
                .thenReturn(holdResult(55L, 300L));

        ApprovalDto.TransitionResult result = approvalService.submit(REQUEST_ID, REQUESTER);

        assertEquals("approved", result.getStatus());
        assertEquals(55L, result.getHoldId());
        assertEquals(ApprovalLevel.AUTO, request.getApprovalLevel());
        verify(approvalEventMapper, times(2)).insert(any(ApprovalEvent.class));
        verify(approvalRequestMapper).updateById(request);
        verifyNoInteractions(organizationService);
    }

    @Test
    void submit_shouldAssignApproverAndSetDeadline() {
        ApprovalRequest request = request(ApprovalStatus.DRAFT, 800L);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(approvalRuleResolver.resolve(COMPANY_ID, 800L)).thenReturn(approverRule());
        when(creditLedgerService.findAccountByCompany(COMPANY_ID)).thenReturn(Optional.of(account()));
        when(creditLedgerService.placeHold(anyLong(), anyLong(), anyLong(), anyString(), any()))
                .thenReturn(holdResult(55L, 800L));
        when(organizationService.findApprover(eq(COMPANY_ID), any(), eq(ApprovalLevel.APPROVER.getEligibleRoles()),
                eq(REQUESTER_ID))).thenReturn(Optional.of(APPROVER_ID));

        ApprovalDto.TransitionResult result = approvalService.submit(REQUEST_ID, REQUESTER);

        assertEquals("pending", result.getStatus());
        assertEquals(APPROVER_ID, result.getCurrentApproverId());
        assertEquals(NOW.plusHours(48), request.getExpiresAt());
        assertEquals(NOW, request.getSubmittedAt());
    }

    @Test
    void submit_shouldReturnExistingHoldWhenRetried() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 800L);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(creditLedgerService.findHoldByRequest(REQUEST_ID))
                .thenReturn(Optional.of(hold(55L, 800L, "request:submit:7")));

        ApprovalDto.TransitionResult result = approvalService.submit(REQUEST_ID, REQUESTER);

        assertEquals("pending", result.getStatus());
        assertEquals(55L, result.getHoldId());
        verify(creditLedgerService, never()).placeHold(anyLong(), anyLong(), anyLong(), anyString(), any());
        verify(approvalEventMapper, never()).insert(any(ApprovalEvent.class));
    }

    @Test
    void submit_shouldRejectWhenActorIsNotRequester() {
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request(ApprovalStatus.DRAFT, 800L));

        assertThrows(ApprovalForbiddenException.class, () -> approvalService.submit(REQUEST_ID, APPROVER));
        verifyNoInteractions(creditLedgerService);
    }

    @Test
    void approve_shouldRejectRequesterEvenWhenAdmin() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 800L);
        request.setApprovalLevel(ApprovalLevel.APPROVER);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        ApprovalActor selfAdmin = new ApprovalActor(REQUESTER_ID, COMPANY_ID, null, OrgRole.ADMIN, false);

        assertThrows(ApprovalForbiddenException.class, () -> approvalService.approve(REQUEST_ID, selfAdmin));
        verify(approvalRequestMapper, never()).updateById(any(ApprovalRequest.class));
    }

    @Test
    void approve_shouldRejectDraftRequest() {
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request(ApprovalStatus.DRAFT, 800L));

        assertThrows(InvalidTransitionException.class, () -> approvalService.approve(REQUEST_ID, APPROVER));
    }

    @Test
    void deny_shouldRequireReason() {
        assertThrows(InvalidInputException.class, () -> approvalService.deny(REQUEST_ID, APPROVER, "  "));
        verifyNoInteractions(approvalRequestMapper);
    }

    @Test
    void deny_shouldReleaseHold() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 800L);
        request.setApprovalLevel(ApprovalLevel.APPROVER);
        request.setCurrentApproverId(APPROVER_ID);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(creditLedgerService.findHoldByRequest(REQUEST_ID))
                .thenReturn(Optional.of(hold(55L, 800L, "request:submit:7")));

        ApprovalDto.TransitionResult result = approvalService.deny(REQUEST_ID, APPROVER, "超出预算");

        assertEquals("denied", result.getStatus());
        assertEquals("超出预算", request.getDecisionReason());
        assertEquals(APPROVER_ID, request.getDecidedBy());
        verify(creditLedgerService).releaseHold(55L, APPROVER_ID);
    }

    @Test
    void fulfill_shouldRejectMemberWhoDidNotDecide() {
        ApprovalRequest request = request(ApprovalStatus.APPROVED, 800L);
        request.setDecidedBy(APPROVER_ID);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);

        assertThrows(ApprovalForbiddenException.class,
                () -> approvalService.fulfill(REQUEST_ID, REQUESTER, 300L, null, null));
        verifyNoInteractions(creditLedgerService);
    }

    @Test
    void fulfill_shouldConvertActualAmountWithDefaultReference() {
        ApprovalRequest request = request(ApprovalStatus.APPROVED, 500L);
        request.setDecidedBy(APPROVER_ID);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(creditLedgerService.findHoldByRequest(REQUEST_ID))
                .thenReturn(Optional.of(hold(55L, 500L, "request:submit:7")));
        LedgerDto.EntryResult entry = new LedgerDto.EntryResult();
        entry.setEntryId(99L);
        entry.setAmount(300L);
        when(creditLedgerService.convertHold(55L, 300L, "approval_request", "7", "request:fulfill:7", APPROVER_ID))
                .thenReturn(entry);

        ApprovalDto.TransitionResult result = approvalService.fulfill(REQUEST_ID, APPROVER, 300L, null, null);

        assertEquals("fulfilled", result.getStatus());
        assertEquals(300L, request.getActualCredits());
        assertEquals(NOW, request.getFulfilledAt());
    }

    @Test
    void escalate_shouldConflictAtTopLevel() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 3000L);
        request.setApprovalLevel(ApprovalLevel.ADMIN);
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);

        assertThrows(ConflictException.class, () -> approvalService.escalate(REQUEST_ID, REQUESTER));
    }

    @Test
    void processOverdue_shouldEscalateWhenRuleAllows() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 800L);
        request.setApprovalLevel(ApprovalLevel.APPROVER);
        request.setCurrentApproverId(APPROVER_ID);
        request.setExpiresAt(NOW.minusMinutes(1));
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(approvalRuleResolver.resolve(COMPANY_ID, 800L)).thenReturn(approverRule());
        when(organizationService.findApprover(eq(COMPANY_ID), any(), eq(ApprovalLevel.ADMIN.getEligibleRoles()),
                eq(REQUESTER_ID))).thenReturn(Optional.of(11L));

        ApprovalDto.TransitionResult result = approvalService.processOverdue(REQUEST_ID);

        assertEquals("pending", result.getStatus());
        assertEquals(ApprovalLevel.ADMIN, request.getApprovalLevel());
        assertEquals(11L, request.getCurrentApproverId());
        assertEquals(1, request.getEscalationCount());
        assertEquals(NOW.plusHours(48), request.getExpiresAt());
        verify(creditLedgerService, never()).releaseHold(any(), any());
    }

    @Test
    void processOverdue_shouldUseDefaultHoursWhenRuleSetsNone() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 800L);
        request.setApprovalLevel(ApprovalLevel.APPROVER);
        request.setExpiresAt(NOW.minusMinutes(1));
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(approvalRuleResolver.resolve(COMPANY_ID, 800L)).thenReturn(new RoutedRule(3L, ApprovalLevel.APPROVER,
                null, ApprovalLevel.ADMIN));
        when(organizationService.findApprover(eq(COMPANY_ID), any(), eq(ApprovalLevel.ADMIN.getEligibleRoles()),
                eq(REQUESTER_ID))).thenReturn(Optional.of(11L));

        approvalService.processOverdue(REQUEST_ID);

        assertEquals(ApprovalLevel.ADMIN, request.getApprovalLevel());
        assertEquals(NOW.plusHours(24), request.getExpiresAt());
    }

    @Test
    void escalate_shouldRestartTimerWithRoutedRuleHours() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 800L);
        request.setApprovalLevel(ApprovalLevel.APPROVER);
        request.setCurrentApproverId(APPROVER_ID);
        request.setExpiresAt(NOW.plusHours(5));
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(approvalRuleResolver.resolve(COMPANY_ID, 800L)).thenReturn(approverRule());
        when(organizationService.findApprover(eq(COMPANY_ID), any(), eq(ApprovalLevel.ADMIN.getEligibleRoles()),
                eq(REQUESTER_ID))).thenReturn(Optional.of(11L));

        approvalService.escalate(REQUEST_ID, REQUESTER);

        assertEquals(ApprovalLevel.ADMIN, request.getApprovalLevel());
        assertEquals(11L, request.getCurrentApproverId());
        assertEquals(NOW.plusHours(48), request.getExpiresAt());
    }

    @Test
    void processOverdue_shouldExpireAndReleaseWhenNoHigherLevel() {
        ApprovalRequest request = request(ApprovalStatus.PENDING, 3000L);
        request.setApprovalLevel(ApprovalLevel.ADMIN);
        request.setExpiresAt(NOW.minusHours(1));
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(request);
        when(approvalRuleResolver.resolve(COMPANY_ID, 3000L)).thenReturn(new RoutedRule(null, ApprovalLevel.ADMIN,
                24, null));
        when(creditLedgerService.findHoldByRequest(REQUEST_ID))
                .thenReturn(Optional.of(hold(55L, 3000L, "request:submit:7")));

        ApprovalDto.TransitionResult result = approvalService.processOverdue(REQUEST_ID);

        assertEquals("expired", result.getStatus());
        verify(creditLedgerService).releaseHold(55L, null);
    }

    @Test
    void sweepOverdue_shouldContinueAfterFailure() {
        ApprovalRequest fresh = request(ApprovalStatus.PENDING, 800L);
        fresh.setId(8L);
        fresh.setExpiresAt(NOW.plusHours(1));
        when(approvalRequestMapper.selectOverduePendingIds(NOW, 100)).thenReturn(List.of(REQUEST_ID, 8L));
        when(approvalRequestMapper.selectByIdForUpdate(REQUEST_ID)).thenReturn(null);
        when(approvalRequestMapper.selectByIdForUpdate(8L)).thenReturn(fresh);

        int processed = approvalService.sweepOverdue();

        assertEquals(1, processed);
        assertNull(fresh.getApprovalLevel());
        verify(approvalRequestMapper, never()).updateById(any(ApprovalRequest.class));
    }

    private ApprovalRequest request(ApprovalStatus status, long estimated) {
        ApprovalRequest request = new ApprovalRequest();
        request.setId(REQUEST_ID);
        request.setCompanyId(COMPANY_ID);
        request.setRequesterId(REQUESTER_ID);
        request.setRequestType(RequestType.values()[0]);
        request.setStatus(status);
        request.setTitle("采购笔记本");
        request.setEstimatedCredits(estimated);
        request.setEscalationCount(0);
        return request;
    }

    private RoutedRule approverRule() {
        return new RoutedRule(null, ApprovalLevel.APPROVER, 48, ApprovalLevel.ADMIN);
    }

    private CreditAccount account() {
        CreditAccount account = new CreditAccount();
        account.setId(10L);
        account.setCompanyId(COMPANY_ID);
        return account;
    }

    private CreditHold hold(Long id, long amount, String key) {
        CreditHold hold = new CreditHold();
        hold.setId(id);
        hold.setAccountId(10L);
        hold.setRequestId(REQUEST_ID);
        hold.setAmount(amount);
        hold.setStatus(HoldStatus.ACTIVE);
        hold.setIdempotencyKey(key);
        return hold;
    }

    private LedgerDto.HoldResult holdResult(Long holdId, long amount) {
        LedgerDto.HoldResult result = new LedgerDto.HoldResult();
        result.setHoldId(holdId);
        result.setAmount(amount);
        result.setStatus("active");
        result.setCreated(true);
        return result;
    }
}
