package com.sunny.procurehub.platform.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.exception.auth.EmailTakenException;
import com.sunny.procurehub.platform.exception.invite.InviteInvalidException;
import com.sunny.procurehub.platform.exception.invite.InviteRaceLostException;
import com.sunny.procurehub.platform.exception.ledger.InsufficientFundsException;
import com.sunny.procurehub.platform.module.approval.dto.ApprovalDto;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRequest;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRule;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalStatus;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalRequestMapper;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalRuleMapper;
import com.sunny.procurehub.platform.module.approval.model.ApprovalActor;
import com.sunny.procurehub.platform.module.approval.service.ApprovalService;
import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.entity.InviteUse;
import com.sunny.procurehub.platform.module.invite.enums.InviteType;
import com.sunny.procurehub.platform.module.invite.mapper.InviteMapper;
import com.sunny.procurehub.platform.module.invite.mapper.InviteUseMapper;
import com.sunny.procurehub.platform.module.ledger.dto.LedgerDto;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import com.sunny.procurehub.platform.module.ledger.entity.LedgerEntry;
import com.sunny.procurehub.platform.module.ledger.enums.HoldStatus;
import com.sunny.procurehub.platform.module.ledger.enums.TransactionType;
import com.sunny.procurehub.platform.module.ledger.mapper.LedgerEntryMapper;
import com.sunny.procurehub.platform.module.ledger.service.CreditLedgerService;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.module.organization.mapper.CompanyMemberMapper;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.module.user.dto.AuthDto;
import com.sunny.procurehub.platform.module.user.entity.User;
import com.sunny.procurehub.platform.module.user.entity.UserSession;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserSessionMapper;
import com.sunny.procurehub.platform.module.user.service.AuthService;
import com.sunny.procurehub.platform.module.user.service.SessionService;
import com.sunny.procurehub.platform.security.TokenGenerator;
import jakarta.servlet.http.Cookie;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

/**
 * 基于 H2 的端到端流程，覆盖并发邀请、账本冻结与会话过期
 */
@SpringBootTest
@AutoConfigureMockMvc
class ProcurementFlowIntegrationTest {

    private static final String PASSWORD = "Tender-Quartz-2048";
    private static final String CLIENT_IP = "203.0.113.7";
    private static final AtomicLong COMPANY_SEQ = new AtomicLong(System.nanoTime() % 1_000_000L);

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private AuthService authService;
    @Autowired
    private SessionService sessionService;
    @Autowired
    private ApprovalService approvalService;
    @Autowired
    private CreditLedgerService creditLedgerService;
    @Autowired
    private OrganizationService organizationService;
    @Autowired
    private InviteMapper inviteMapper;
    @Autowired
    private UserMapper userMapper;
    @Autowired
    private UserSessionMapper userSessionMapper;
    @Autowired
    private ProfileMapper profileMapper;
    @Autowired
    private InviteUseMapper inviteUseMapper;
    @Autowired
    private CompanyMemberMapper companyMemberMapper;
    @SpyBean
    private PasswordEncoder passwordEncoder;
    @Autowired
    private ApprovalRequestMapper approvalRequestMapper;
    @Autowired
    private ApprovalRuleMapper approvalRuleMapper;
    @Autowired
    private LedgerEntryMapper ledgerEntryMapper;
    @Autowired
    private TokenGenerator tokenGenerator;
    @Autowired
    private Clock clock;

    @Test
    void register_shouldLetOnlyOneUserConsumeSingleUseInviteUnderRace() throws Exception {
        Invite invite = insertLinkInvite(1);
        String firstEmail = uniqueEmail("race-a");
        String secondEmail = uniqueEmail("race-b");
        long usersBefore = userMapper.selectCount(null);
        long profilesBefore = profileMapper.selectCount(null);
        long sessionsBefore = userSessionMapper.selectCount(null);
        long membersBefore = companyMemberMapper.selectCount(null);

        // 两个请求都通过事务外的邀请预检后才进入哈希，争用只能在行锁处分出胜负
        CyclicBarrier prechecked = new CyclicBarrier(2);
        doAnswer(invocation -> {
            prechecked.await(30, TimeUnit.SECONDS);
            return invocation.callRealMethod();
        }).when(passwordEncoder).encode(any());

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Throwable> failures = new ArrayList<>();
        int succeeded = 0;
        try {
            List<Future<AuthDto.AuthResult>> futures = new ArrayList<>();
            for (String email : List.of(firstEmail, secondEmail)) {
                Callable<AuthDto.AuthResult> task = () -> {
                    start.await();
                    return authService.register(register(email, invite.getCode()), CLIENT_IP, null);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            for (Future<AuthDto.AuthResult> future : futures) {
                try {
                    assertNotNull(future.get(60, TimeUnit.SECONDS).getSessionToken());
                    succeeded++;
                } catch (ExecutionException ex) {
                    failures.add(ex.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, succeeded);
        assertEquals(1, failures.size());
        assertInstanceOf(InviteRaceLostException.class, failures.get(0));

        User firstUser = userMapper.selectByEmail(firstEmail);
        User secondUser = userMapper.selectByEmail(secondEmail);
        assertTrue(firstUser == null ^ secondUser == null);
        User winner = firstUser != null ? firstUser : secondUser;

        assertEquals(1, inviteMapper.selectById(invite.getId()).getUseCount());
        List<InviteUse> uses = inviteUseMapper.selectList(new LambdaQueryWrapper<InviteUse>()
                .eq(InviteUse::getInviteId, invite.getId()));
        assertEquals(1, uses.size());
        assertEquals(winner.getId(), uses.get(0).getUserId());

        assertEquals(usersBefore + 1, userMapper.selectCount(null));
        assertEquals(profilesBefore + 1, profileMapper.selectCount(null));
        assertEquals(sessionsBefore + 1, userSessionMapper.selectCount(null));
        assertEquals(membersBefore, companyMemberMapper.selectCount(null));
        assertEquals(1, userSessionMapper.selectCount(new LambdaQueryWrapper<UserSession>()
                .eq(UserSession::getUserId, winner.getId())));
        assertNotNull(profileMapper.selectById(winner.getId()));
    }

    @Test
    void register_shouldTreatEmailCaseInsensitively() {
        Invite invite = insertLinkInvite(5);
        String local = "buyer-" + UUID.randomUUID().toString().substring(0, 8);

        AuthDto.AuthResult created = authService.register(register(local + "@Example.COM", invite.getCode()),
                CLIENT_IP, null);
        assertEquals(local + "@example.com", created.getUser().getEmail());

        assertThrows(EmailTakenException.class,
                () -> authService.register(register(local.toUpperCase() + "@example.com", invite.getCode()),
                        CLIENT_IP, null));

        AuthDto.Login login = new AuthDto.Login();
        login.setEmail(local.toUpperCase() + "@EXAMPLE.com");
        login.setPassword(PASSWORD);
        assertEquals(created.getUser().getId(), authService.login(login, CLIENT_IP, null).getUser().getId());

        User duplicate = new User();
        duplicate.setEmail(local.toUpperCase() + "@EXAMPLE.COM");
        duplicate.setPasswordHash("x");
        duplicate.setCreatedAt(LocalDateTime.now(clock));
        duplicate.setUpdatedAt(LocalDateTime.now(clock));
        assertThrows(DataIntegrityViolationException.class, () -> userMapper.insert(duplicate));
    }

    @Test
    void deny_shouldReleaseHoldAndRestoreAvailableCredits() {
        Company company = company(1000L);
        ApprovalRule rule = new ApprovalRule();
        rule.setCompanyId(company.id());
        rule.setName("所有请求需审批");
        rule.setMinCredits(0L);
        rule.setApproverRole(ApprovalLevel.APPROVER);
        rule.setEscalationHours(48);
        rule.setEscalateTo(ApprovalLevel.ADMIN);
        rule.setPriority(1);
        rule.setActive(true);
        rule.setCreatedAt(LocalDateTime.now(clock));
        approvalRuleMapper.insert(rule);

        ApprovalRequest request = approvalService.createRequest(company.requester(), create(300L));
        ApprovalDto.TransitionResult submitted = approvalService.submit(request.getId(), company.requester());
        assertEquals("pending", submitted.getStatus());
        assertEquals(company.approver().userId(), submitted.getCurrentApproverId());
        assertEquals(700L, creditLedgerService.balance(company.accountId()).getAvailableCredits());

        ApprovalDto.TransitionResult denied = approvalService.deny(request.getId(), company.approver(), "预算已冻结");

        assertEquals("denied", denied.getStatus());
        assertEquals(1000L, creditLedgerService.balance(company.accountId()).getAvailableCredits());
        CreditHold hold = creditLedgerService.findHoldByRequest(request.getId()).orElseThrow();
        assertEquals(HoldStatus.RELEASED, hold.getStatus());
        assertTrue(creditLedgerService.listActiveHolds(company.accountId()).isEmpty());
    }

    @Test
    void fulfill_shouldDebitActualAmountAndReleaseRemainder() {
        Company company = company(1000L);
        ApprovalRequest request = approvalService.createRequest(company.requester(), create(500L));
        approvalService.submit(request.getId(), company.requester());
        assertEquals(500L, creditLedgerService.balance(company.accountId()).getAvailableCredits());
        approvalService.approve(request.getId(), company.approver());

        ApprovalDto.TransitionResult fulfilled = approvalService.fulfill(request.getId(), company.approver(), 300L,
                null, null);

        assertEquals("fulfilled", fulfilled.getStatus());
        LedgerDto.Balance balance = creditLedgerService.balance(company.accountId());
        assertEquals(700L, balance.getAvailableCredits());
        assertEquals(0L, balance.getReservedCredits());
        List<LedgerEntry> entries = ledgerEntryMapper.selectList(new LambdaQueryWrapper<LedgerEntry>()
                .eq(LedgerEntry::getAccountId, company.accountId()));
        assertEquals(1, entries.size());
        assertEquals(300L, entries.get(0).getAmount());
        assertEquals(TransactionType.HOLD_CONVERSION, entries.get(0).getTransactionType());
        assertEquals(String.valueOf(request.getId()), entries.get(0).getReferenceId());
        assertEquals(300L, approvalRequestMapper.selectById(request.getId()).getActualCredits());
    }

    @Test
    void submit_shouldPlaceSingleHoldWhenRepeated() {
        Company company = company(1000L);
        ApprovalRequest request = approvalService.createRequest(company.requester(), create(600L));

        ApprovalDto.TransitionResult first = approvalService.submit(request.getId(), company.requester());
        ApprovalDto.TransitionResult second = approvalService.submit(request.getId(), company.requester());

        assertEquals(first.getHoldId(), second.getHoldId());
        assertEquals(1, creditLedgerService.listActiveHolds(company.accountId()).size());
        assertEquals(400L, creditLedgerService.balance(company.accountId()).getAvailableCredits());
    }

    @Test
    void ledger_shouldKeepSingleEffectWhenHoldOperationsReplayed() {
        Company company = company(1000L);
        long requestId = 1_000_000_000L + COMPANY_SEQ.incrementAndGet();
        Long actorId = company.approver().userId();

        LedgerDto.HoldResult placed = creditLedgerService.placeHold(company.accountId(), requestId, 300L,
                "request:submit:" + requestId, actorId);
        LedgerDto.HoldResult placedAgain = creditLedgerService.placeHold(company.accountId(), requestId, 300L,
                "request:submit:" + requestId, actorId);

        assertTrue(placed.isCreated());
        assertFalse(placedAgain.isCreated());
        assertEquals(placed.getHoldId(), placedAgain.getHoldId());
        assertEquals(1, creditLedgerService.listActiveHolds(company.accountId()).size());
        assertEquals(700L, creditLedgerService.balance(company.accountId()).getAvailableCredits());

        String convertKey = "request:fulfill:" + requestId;
        LedgerDto.EntryResult converted = creditLedgerService.convertHold(placed.getHoldId(), 200L,
                "approval_request", String.valueOf(requestId), convertKey, actorId);
        LedgerDto.EntryResult convertedAgain = creditLedgerService.convertHold(placed.getHoldId(), 200L,
                "approval_request", String.valueOf(requestId), convertKey, actorId);

        assertFalse(converted.isReplayed());
        assertTrue(convertedAgain.isReplayed());
        assertEquals(converted.getEntryId(), convertedAgain.getEntryId());
        assertEquals(800L, converted.getAvailableCredits());
        assertEquals(800L, convertedAgain.getAvailableCredits());
        List<LedgerEntry> entries = ledgerEntryMapper.selectList(new LambdaQueryWrapper<LedgerEntry>()
                .eq(LedgerEntry::getAccountId, company.accountId()));
        assertEquals(1, entries.size());
        assertEquals(200L, entries.get(0).getAmount());

        long otherRequestId = 1_000_000_000L + COMPANY_SEQ.incrementAndGet();
        LedgerDto.HoldResult other = creditLedgerService.placeHold(company.accountId(), otherRequestId, 100L,
                "request:submit:" + otherRequestId, actorId);
        assertEquals(700L, creditLedgerService.balance(company.accountId()).getAvailableCredits());

        LedgerDto.ReleaseResult released = creditLedgerService.releaseHold(other.getHoldId(), actorId);
        LedgerDto.ReleaseResult releasedAgain = creditLedgerService.releaseHold(other.getHoldId(), actorId);

        assertFalse(released.isAlreadyTerminal());
        assertTrue(releasedAgain.isAlreadyTerminal());
        assertEquals(800L, released.getAvailableCredits());
        assertEquals(800L, releasedAgain.getAvailableCredits());
        assertEquals(800L, creditLedgerService.balance(company.accountId()).getAvailableCredits());
        assertEquals(1, ledgerEntryMapper.selectCount(new LambdaQueryWrapper<LedgerEntry>()
                .eq(LedgerEntry::getAccountId, company.accountId())));
        assertTrue(creditLedgerService.listActiveHolds(company.accountId()).isEmpty());
    }

    @Test
    void submit_shouldRejectAndKeepDraftWhenFundsInsufficient() {
        Company company = company(100L);
        ApprovalRequest request = approvalService.createRequest(company.requester(), create(500L));

        InsufficientFundsException exception = assertThrows(InsufficientFundsException.class,
                () -> approvalService.submit(request.getId(), company.requester()));

        assertEquals(100L, exception.getAvailable());
        assertEquals(ApprovalStatus.DRAFT, approvalRequestMapper.selectById(request.getId()).getStatus());
        assertTrue(creditLedgerService.findHoldByRequest(request.getId()).isEmpty());
        assertEquals(100L, creditLedgerService.balance(company.accountId()).getAvailableCredits());
    }

    @Test
    void expiredSession_shouldBeRejectedButLogoutStillSucceeds() throws Exception {
        Long userId = insertUser(uniqueEmail("expired"));
        UserSession session = new UserSession();
        session.setUserId(userId);
        session.setToken(tokenGenerator.randomToken());
        session.setCreatedAt(LocalDateTime.now(clock).minusDays(31));
        session.setExpiresAt(LocalDateTime.now(clock).minusMinutes(1));
        userSessionMapper.insert(session);

        assertTrue(sessionService.resolve(session.getToken()).isEmpty());

        Cookie cookie = new Cookie("ph_session", session.getToken());
        mockMvc.perform(get("/approvals/mine").cookie(cookie))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/auth/logout").cookie(cookie))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(0));
        mockMvc.perform(post("/auth/logout"))
                .andExpect(status().isOk());

        assertNull(userSessionMapper.selectById(session.getId()));
    }

    @Test
    void register_shouldRejectUnknownInviteCode() {
        assertThrows(InviteInvalidException.class,
                () -> authService.register(register(uniqueEmail("nobody"), "ZZZZ9999"), CLIENT_IP, null));
    }

    private Company company(long totalCredits) {
        long companyId = COMPANY_SEQ.incrementAndGet();
        Long requesterId = insertUser(uniqueEmail("requester"));
        Long approverId = insertUser(uniqueEmail("approver"));
        organizationService.addMember(companyId, requesterId, null, OrgRole.MEMBER);
        organizationService.addMember(companyId, approverId, null, OrgRole.APPROVER);

        LedgerDto.OpenAccount open = new LedgerDto.OpenAccount();
        open.setCompanyId(companyId);
        open.setSubscriptionTier("professional");
        open.setPeriodStart(LocalDateTime.now(clock).minusDays(1));
        open.setPeriodEnd(LocalDateTime.now(clock).plusDays(30));
        open.setTotalCredits(totalCredits);
        open.setBonusCredits(0L);
        CreditAccount account = creditLedgerService.openAccount(open);

        return new Company(companyId, account.getId(),
                new ApprovalActor(requesterId, companyId, null, OrgRole.MEMBER, false),
                new ApprovalActor(approverId, companyId, null, OrgRole.APPROVER, false));
    }

    private Long insertUser(String email) {
        User user = new User();
        user.setEmail(email);
        user.setPasswordHash("unused");
        user.setCreatedAt(LocalDateTime.now(clock));
        user.setUpdatedAt(LocalDateTime.now(clock));
        userMapper.insert(user);
        return user.getId();
    }

    private Invite insertLinkInvite(int maxUses) {
        Invite invite = new Invite();
        invite.setCode(UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase());
        invite.setInviteType(InviteType.LINK);
        invite.setMaxUses(maxUses);
        invite.setUseCount(0);
        invite.setExpiresAt(LocalDateTime.now(clock).plusDays(7));
        invite.setCreatedAt(LocalDateTime.now(clock));
        inviteMapper.insert(invite);
        return invite;
    }

    private AuthDto.Register register(String email, String code) {
        AuthDto.Register dto = new AuthDto.Register();
        dto.setEmail(email);
        dto.setPassword(PASSWORD);
        dto.setInviteCode(code);
        return dto;
    }

    private ApprovalDto.Create create(long credits) {
        ApprovalDto.Create dto = new ApprovalDto.Create();
        dto.setRequestType("analyst_call");
        dto.setTitle("供应商背景调研");
        dto.setEstimatedCredits(credits);
        dto.setContext(Map.of("vendor", "acme"));
        return dto;
    }

    private static String uniqueEmail(String prefix) {
        return prefix + "-" + UUID.randomUUID() + "@procurehub.test";
    }

    private record Company(Long id, Long accountId, ApprovalActor requester, ApprovalActor approver) {
    }
}
