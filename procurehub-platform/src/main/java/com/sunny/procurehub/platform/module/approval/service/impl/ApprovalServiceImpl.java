package com.sunny.procurehub.platform.module.approval.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ConflictException;
import com.sunny.procurehub.common.exception.ForbiddenException;
import com.sunny.procurehub.common.exception.InternalException;
import com.sunny.procurehub.common.exception.NotFoundException;
import com.sunny.procurehub.platform.config.ApprovalProperties;
import com.sunny.procurehub.platform.exception.approval.ApprovalForbiddenException;
import com.sunny.procurehub.platform.exception.approval.InvalidTransitionException;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.exception.ledger.HoldNotActiveException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.approval.dto.ApprovalDto;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalEvent;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRequest;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalAction;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalEventType;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalStatus;
import com.sunny.procurehub.platform.module.approval.enums.RequestType;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalEventMapper;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalRequestMapper;
import com.sunny.procurehub.platform.module.approval.model.ApprovalActor;
import com.sunny.procurehub.platform.module.approval.model.RoutedRule;
import com.sunny.procurehub.platform.module.approval.service.ApprovalRuleResolver;
import com.sunny.procurehub.platform.module.approval.service.ApprovalService;
import com.sunny.procurehub.platform.module.ledger.dto.LedgerDto;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import com.sunny.procurehub.platform.module.ledger.service.CreditLedgerService;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 审批服务实现
 *
 * <p>所有流转先锁请求行，再由账本服务锁冻结与账户。冻结幂等键固定为
 * {@code request:submit:<id>}，转换幂等键固定为 {@code request:fulfill:<id>}。
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalServiceImpl implements ApprovalService {

    static final String SUBMIT_KEY_PREFIX = "request:submit:";
    static final String FULFILL_KEY_PREFIX = "request:fulfill:";
    static final String REFERENCE_TYPE = "approval_request";

    private static final int MAX_REASON_LENGTH = 500;

    private final ApprovalRequestMapper approvalRequestMapper;
    private final ApprovalEventMapper approvalEventMapper;
    private final ApprovalRuleResolver approvalRuleResolver;
    private final CreditLedgerService creditLedgerService;
    private final OrganizationService organizationService;
    private final TransactionExecutor transactionExecutor;
    private final ApprovalProperties approvalProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ApprovalRequest createRequest(ApprovalActor actor, ApprovalDto.Create dto) {
        if (actor == null || actor.system() || actor.companyId() == null) {
            throw new ForbiddenException("当前用户未加入公司，无法发起审批");
        }
        if (dto == null) {
            throw new InvalidInputException("审批请求参数不能为空");
        }
        RequestType requestType = parseRequestType(dto.getRequestType());
        String title = StringUtils.hasText(dto.getTitle()) ? dto.getTitle().trim() : null;
        if (title == null) {
            throw new InvalidInputException("标题不能为空");
        }
        if (dto.getEstimatedCredits() == null || dto.getEstimatedCredits() <= 0) {
            throw new InvalidInputException("预估积分必须大于0");
        }
        String context = dto.getContext() == null ? null : writeJson(dto.getContext());

        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            ApprovalRequest request = new ApprovalRequest();
            request.setCompanyId(actor.companyId());
            request.setTeamId(actor.teamId());
            request.setRequesterId(actor.userId());
            request.setRequestType(requestType);
            request.setStatus(ApprovalStatus.DRAFT);
            request.setTitle(title);
            request.setDescription(dto.getDescription());
            request.setEstimatedCredits(dto.getEstimatedCredits());
            request.setContext(context);
            request.setEscalationCount(0);
            request.setCreatedAt(now);
            request.setUpdatedAt(now);
            approvalRequestMapper.insert(request);

            recordEvent(request, ApprovalEventType.CREATED, actor, null, ApprovalStatus.DRAFT, null,
                    metadata("estimatedCredits", request.getEstimatedCredits(), "requestType", requestType.getCode()));
            log.info("approval_event event=created requestId={} companyId={} requesterId={} type={} estimated={}",
                    request.getId(), request.getCompanyId(), request.getRequesterId(), requestType.getCode(),
                    request.getEstimatedCredits());
            return request;
        });
    }

    @Override
    public ApprovalDto.TransitionResult transition(Long requestId, ApprovalAction action, ApprovalActor actor,
                                                   ApprovalDto.Transition payload) {
        if (action == null) {
            throw new InvalidInputException("审批动作不能为空");
        }
        ApprovalDto.Transition body = payload == null ? new ApprovalDto.Transition() : payload;
        return switch (action) {
            case SUBMIT -> submit(requestId, actor);
            case APPROVE -> approve(requestId, actor);
            case DENY -> deny(requestId, actor, body.getReason());
            case CANCEL -> cancel(requestId, actor);
            case FULFILL -> fulfill(requestId, actor, body.getActualCredits(), body.getReferenceType(),
                    body.getReferenceId());
            case ESCALATE -> escalate(requestId, actor);
        };
    }

    @Override
    public ApprovalDto.TransitionResult submit(Long requestId, ApprovalActor actor) {
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            if (actor == null || actor.system() || !Objects.equals(actor.userId(), request.getRequesterId())) {
                throw new ApprovalForbiddenException();
            }
            String holdKey = SUBMIT_KEY_PREFIX + request.getId();

            // 重复提交：已有同键冻结时原样返回
            if (request.getStatus() == ApprovalStatus.PENDING || request.getStatus() == ApprovalStatus.APPROVED) {
                CreditHold existing = creditLedgerService.findHoldByRequest(request.getId()).orElse(null);
                if (existing != null && holdKey.equals(existing.getIdempotencyKey())) {
                    log.info("approval_event event=submit_replayed requestId={} status={} holdId={}",
                            request.getId(), request.getStatus().getCode(), existing.getId());
                    return toResult(request, existing.getId());
                }
            }
            ensureTransition(request, ApprovalStatus.PENDING, ApprovalAction.SUBMIT);

            RoutedRule rule = approvalRuleResolver.resolve(request.getCompanyId(), request.getEstimatedCredits());
            CreditAccount account = creditLedgerService.findAccountByCompany(request.getCompanyId())
                    .orElseThrow(() -> new NotFoundException("公司未开通积分账户: companyId=%s", request.getCompanyId()));
            LedgerDto.HoldResult hold = creditLedgerService.placeHold(account.getId(), request.getId(),
                    request.getEstimatedCredits(), holdKey, actor.userId());

            LocalDateTime now = LocalDateTime.now(clock);
            ApprovalStatus from = request.getStatus();
            request.setStatus(ApprovalStatus.PENDING);
            request.setApprovalLevel(rule.level());
            request.setSubmittedAt(now);
            request.setUpdatedAt(now);
            recordEvent(request, ApprovalEventType.SUBMITTED, actor, from, ApprovalStatus.PENDING, null,
                    metadata("holdId", hold.getHoldId(), "level", rule.level().getCode(), "ruleId", rule.ruleId()));

            if (rule.isAuto()) {
                request.setStatus(ApprovalStatus.APPROVED);
                request.setDecidedAt(now);
                recordEvent(request, ApprovalEventType.AUTO_APPROVED, ApprovalActor.SYSTEM, ApprovalStatus.PENDING,
                        ApprovalStatus.APPROVED, null, metadata("estimatedCredits", request.getEstimatedCredits()));
            } else {
                Long approverId = organizationService.findApprover(request.getCompanyId(), request.getTeamId(),
                        rule.level().getEligibleRoles(), request.getRequesterId()).orElse(null);
                request.setCurrentApproverId(approverId);
                request.setExpiresAt(now.plusHours(escalationHours(rule)));
                if (approverId != null) {
                    recordEvent(request, ApprovalEventType.ASSIGNED, ApprovalActor.SYSTEM, ApprovalStatus.PENDING,
                            ApprovalStatus.PENDING, null, metadata("approverId", approverId,
                                    "level", rule.level().getCode()));
                } else {
                    log.warn("approval_event event=approver_unavailable requestId={} companyId={} level={}",
                            request.getId(), request.getCompanyId(), rule.level().getCode());
                }
            }
            approvalRequestMapper.updateById(request);

            log.info("approval_event event=submitted requestId={} level={} status={} holdId={} approverId={} expiresAt={}",
                    request.getId(), rule.level().getCode(), request.getStatus().getCode(), hold.getHoldId(),
                    request.getCurrentApproverId(), request.getExpiresAt());
            return toResult(request, hold.getHoldId());
        });
    }

    @Override
    public ApprovalDto.TransitionResult approve(Long requestId, ApprovalActor actor) {
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            ensureTransition(request, ApprovalStatus.APPROVED, ApprovalAction.APPROVE);
            requireDecider(request, actor);

            LocalDateTime now = LocalDateTime.now(clock);
            request.setStatus(ApprovalStatus.APPROVED);
            request.setDecidedBy(actor.userId());
            request.setDecidedAt(now);
            request.setUpdatedAt(now);
            approvalRequestMapper.updateById(request);
            recordEvent(request, ApprovalEventType.APPROVED, actor, ApprovalStatus.PENDING, ApprovalStatus.APPROVED,
                    null, metadata("level", codeOf(request.getApprovalLevel())));

            log.info("approval_event event=approved requestId={} approverId={} level={}",
                    request.getId(), actor.userId(), codeOf(request.getApprovalLevel()));
            return toResult(request, holdIdOf(request));
        });
    }

    @Override
    public ApprovalDto.TransitionResult deny(Long requestId, ApprovalActor actor, String reason) {
        String normalizedReason = normalizeReason(reason);
        if (normalizedReason == null) {
            throw new InvalidInputException("拒绝原因不能为空");
        }
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            ensureTransition(request, ApprovalStatus.DENIED, ApprovalAction.DENY);
            requireDecider(request, actor);

            Long holdId = releaseHoldIfPresent(request, actor);
            LocalDateTime now = LocalDateTime.now(clock);
            request.setStatus(ApprovalStatus.DENIED);
            request.setDecisionReason(normalizedReason);
            request.setDecidedBy(actor.userId());
            request.setDecidedAt(now);
            request.setUpdatedAt(now);
            approvalRequestMapper.updateById(request);
            recordEvent(request, ApprovalEventType.DENIED, actor, ApprovalStatus.PENDING, ApprovalStatus.DENIED,
                    normalizedReason, metadata("holdId", holdId));

            log.info("approval_event event=denied requestId={} approverId={} holdId={}",
                    request.getId(), actor.userId(), holdId);
            return toResult(request, holdId);
        });
    }

    @Override
    public ApprovalDto.TransitionResult cancel(Long requestId, ApprovalActor actor) {
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            ensureTransition(request, ApprovalStatus.CANCELLED, ApprovalAction.CANCEL);
            boolean requester = actor != null && !actor.system()
                    && Objects.equals(actor.userId(), request.getRequesterId());
            boolean companyAdmin = actor != null && actor.isAdminOrOwner() && actor.belongsTo(request.getCompanyId());
            if (!requester && !companyAdmin) {
                throw new ApprovalForbiddenException();
            }

            ApprovalStatus from = request.getStatus();
            Long holdId = releaseHoldIfPresent(request, actor);
            LocalDateTime now = LocalDateTime.now(clock);
            request.setStatus(ApprovalStatus.CANCELLED);
            request.setUpdatedAt(now);
            approvalRequestMapper.updateById(request);
            recordEvent(request, ApprovalEventType.CANCELLED, actor, from, ApprovalStatus.CANCELLED, null,
                    metadata("holdId", holdId));

            log.info("approval_event event=cancelled requestId={} actorId={} from={} holdId={}",
                    request.getId(), actor.userId(), from.getCode(), holdId);
            return toResult(request, holdId);
        });
    }

    @Override
    public ApprovalDto.TransitionResult fulfill(Long requestId, ApprovalActor actor, Long actualCredits,
                                                String referenceType, String referenceId) {
        if (actualCredits != null && actualCredits <= 0) {
            throw new InvalidInputException("实际积分必须大于0");
        }
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            ensureTransition(request, ApprovalStatus.FULFILLED, ApprovalAction.FULFILL);
            boolean companyAdmin = actor != null && actor.isAdminOrOwner() && actor.belongsTo(request.getCompanyId());
            boolean decider = actor != null && !actor.system() && actor.userId() != null
                    && actor.userId().equals(request.getDecidedBy());
            if (!companyAdmin && !decider) {
                throw new ApprovalForbiddenException();
            }

            CreditHold hold = creditLedgerService.findHoldByRequest(request.getId())
                    .orElseThrow(HoldNotActiveException::new);
            long amount = actualCredits == null ? hold.getAmount() : actualCredits;
            String refType = StringUtils.hasText(referenceType) ? referenceType.trim() : REFERENCE_TYPE;
            String refId = StringUtils.hasText(referenceId) ? referenceId.trim() : String.valueOf(request.getId());
            LedgerDto.EntryResult entry = creditLedgerService.convertHold(hold.getId(), amount, refType, refId,
                    FULFILL_KEY_PREFIX + request.getId(), actor.userId());

            LocalDateTime now = LocalDateTime.now(clock);
            request.setStatus(ApprovalStatus.FULFILLED);
            request.setActualCredits(amount);
            request.setFulfilledAt(now);
            request.setUpdatedAt(now);
            approvalRequestMapper.updateById(request);
            recordEvent(request, ApprovalEventType.FULFILLED, actor, ApprovalStatus.APPROVED, ApprovalStatus.FULFILLED,
                    null, metadata("holdId", hold.getId(), "entryId", entry.getEntryId(),
                            "holdAmount", hold.getAmount(), "actualCredits", amount,
                            "releasedCredits", hold.getAmount() - amount));

            log.info("approval_event event=fulfilled requestId={} actorId={} holdId={} holdAmount={} actual={}",
                    request.getId(), actor.userId(), hold.getId(), hold.getAmount(), amount);
            return toResult(request, hold.getId());
        });
    }

    @Override
    public ApprovalDto.TransitionResult escalate(Long requestId, ApprovalActor actor) {
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            if (request.getStatus() != ApprovalStatus.PENDING) {
                throw new InvalidTransitionException(request.getStatus().getCode(), ApprovalAction.ESCALATE.getCode());
            }
            boolean involved = actor != null && !actor.system() && actor.userId() != null
                    && (actor.userId().equals(request.getRequesterId())
                    || actor.userId().equals(request.getCurrentApproverId()));
            boolean companyAdmin = actor != null && actor.isAdminOrOwner() && actor.belongsTo(request.getCompanyId());
            if (!involved && !companyAdmin) {
                throw new ApprovalForbiddenException();
            }
            ApprovalLevel current = request.getApprovalLevel() == null ? ApprovalLevel.AUTO : request.getApprovalLevel();
            ApprovalLevel target = current.next();
            if (target == null) {
                throw new ConflictException(ErrorType.CONFLICT, Map.of("level", current.getCode()), "已是最高审批层级");
            }
            RoutedRule rule = approvalRuleResolver.resolve(request.getCompanyId(), request.getEstimatedCredits());
            escalateTo(request, target, rule, actor, "manual");
            return toResult(request, holdIdOf(request));
        });
    }

    @Override
    public ApprovalDto.TransitionResult processOverdue(Long requestId) {
        return transactionExecutor.execute(DbScene.APPROVAL, () -> {
            ApprovalRequest request = lockRequest(requestId);
            LocalDateTime now = LocalDateTime.now(clock);
            if (request.getStatus() != ApprovalStatus.PENDING || request.getExpiresAt() == null
                    || !request.getExpiresAt().isBefore(now)) {
                log.debug("approval_event event=sweep_skipped requestId={} status={}",
                        request.getId(), request.getStatus().getCode());
                return toResult(request, holdIdOf(request));
            }

            RoutedRule rule = approvalRuleResolver.resolve(request.getCompanyId(), request.getEstimatedCredits());
            if (rule.canEscalateFrom(request.getApprovalLevel())) {
                escalateTo(request, rule.escalateTo(), rule, ApprovalActor.SYSTEM, "timeout");
                return toResult(request, holdIdOf(request));
            }

            Long holdId = releaseHoldIfPresent(request, ApprovalActor.SYSTEM);
            request.setStatus(ApprovalStatus.EXPIRED);
            request.setUpdatedAt(now);
            approvalRequestMapper.updateById(request);
            recordEvent(request, ApprovalEventType.EXPIRED, ApprovalActor.SYSTEM, ApprovalStatus.PENDING,
                    ApprovalStatus.EXPIRED, null, metadata("holdId", holdId, "expiresAt", request.getExpiresAt().toString()));
            log.info("approval_event event=expired requestId={} holdId={} level={}",
                    request.getId(), holdId, codeOf(request.getApprovalLevel()));
            return toResult(request, holdId);
        });
    }

    @Override
    public int sweepOverdue() {
        int batchSize = Math.max(1, approvalProperties.getSweep().getBatchSize());
        List<Long> candidates = approvalRequestMapper.selectOverduePendingIds(LocalDateTime.now(clock), batchSize);
        int processed = 0;
        for (Long requestId : candidates) {
            try {
                processOverdue(requestId);
                processed++;
            } catch (RuntimeException ex) {
                log.error("approval_event event=sweep_failed requestId={}", requestId, ex);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("approval_event event=sweep_completed candidates={} processed={}", candidates.size(), processed);
        }
        return processed;
    }

    @Override
    public ApprovalRequest getRequest(Long requestId, ApprovalActor actor) {
        ApprovalRequest request = approvalRequestMapper.selectById(requestId);
        if (request == null) {
            throw new NotFoundException("审批请求不存在: %s", requestId);
        }
        boolean requester = actor != null && actor.userId() != null && actor.userId().equals(request.getRequesterId());
        if (!requester && (actor == null || !actor.belongsTo(request.getCompanyId()))) {
            throw new ApprovalForbiddenException();
        }
        return request;
    }

    @Override
    public IPage<ApprovalRequest> listPendingForApprover(Long approverId, int limit, int offset) {
        Page<ApprovalRequest> page = Page.of(resolveCurrent(limit, offset), limit);
        LambdaQueryWrapper<ApprovalRequest> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(ApprovalRequest::getCurrentApproverId, approverId)
                .eq(ApprovalRequest::getStatus, ApprovalStatus.PENDING)
                .orderByAsc(ApprovalRequest::getExpiresAt)
                .orderByAsc(ApprovalRequest::getId);
        return approvalRequestMapper.selectPage(page, wrapper);
    }

    @Override
    public IPage<ApprovalRequest> listByRequester(Long requesterId, int limit, int offset) {
        Page<ApprovalRequest> page = Page.of(resolveCurrent(limit, offset), limit);
        LambdaQueryWrapper<ApprovalRequest> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(ApprovalRequest::getRequesterId, requesterId)
                .orderByDesc(ApprovalRequest::getCreatedAt)
                .orderByDesc(ApprovalRequest::getId);
        return approvalRequestMapper.selectPage(page, wrapper);
    }

    @Override
    public List<ApprovalEvent> listEvents(Long requestId, ApprovalActor actor) {
        ApprovalRequest request = getRequest(requestId, actor);
        LambdaQueryWrapper<ApprovalEvent> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(ApprovalEvent::getRequestId, request.getId())
                .orderByAsc(ApprovalEvent::getId);
        return approvalEventMapper.selectList(wrapper);
    }

    private void escalateTo(ApprovalRequest request, ApprovalLevel target, RoutedRule rule, ApprovalActor actor,
                            String trigger) {
        ApprovalLevel previousLevel = request.getApprovalLevel();
        Long previousApprover = request.getCurrentApproverId();
        Long approverId = organizationService.findApprover(request.getCompanyId(), request.getTeamId(),
                target.getEligibleRoles(), request.getRequesterId()).orElse(null);

        LocalDateTime now = LocalDateTime.now(clock);
        int escalationCount = (request.getEscalationCount() == null ? 0 : request.getEscalationCount()) + 1;
        request.setApprovalLevel(target);
        request.setCurrentApproverId(approverId);
        request.setEscalationCount(escalationCount);
        request.setExpiresAt(now.plusHours(escalationHours(rule)));
        request.setUpdatedAt(now);
        approvalRequestMapper.updateById(request);
        if (approverId == null) {
            // updateById 不写空值
            LambdaUpdateWrapper<ApprovalRequest> clear = new LambdaUpdateWrapper<>();
            clear.eq(ApprovalRequest::getId, request.getId())
                    .set(ApprovalRequest::getCurrentApproverId, null);
            approvalRequestMapper.update(null, clear);
        }

        recordEvent(request, ApprovalEventType.ESCALATED, actor, ApprovalStatus.PENDING, ApprovalStatus.PENDING, null,
                metadata("fromLevel", codeOf(previousLevel), "toLevel", target.getCode(),
                        "previousApproverId", previousApprover, "trigger", trigger,
                        "escalationCount", escalationCount));
        if (approverId != null) {
            recordEvent(request, ApprovalEventType.ASSIGNED, ApprovalActor.SYSTEM, ApprovalStatus.PENDING,
                    ApprovalStatus.PENDING, null, metadata("approverId", approverId, "level", target.getCode()));
        }
        log.info("approval_event event=escalated requestId={} fromLevel={} toLevel={} approverId={} trigger={} count={}",
                request.getId(), codeOf(previousLevel), target.getCode(), approverId, trigger, escalationCount);
    }

    private Long releaseHoldIfPresent(ApprovalRequest request, ApprovalActor actor) {
        CreditHold hold = creditLedgerService.findHoldByRequest(request.getId()).orElse(null);
        if (hold == null) {
            return null;
        }
        creditLedgerService.releaseHold(hold.getId(), actor == null ? null : actor.userId());
        return hold.getId();
    }

    private void requireDecider(ApprovalRequest request, ApprovalActor actor) {
        if (actor == null || actor.system() || actor.userId() == null) {
            throw new ApprovalForbiddenException();
        }
        if (actor.userId().equals(request.getRequesterId()) || !actor.belongsTo(request.getCompanyId())) {
            throw new ApprovalForbiddenException();
        }
        if (actor.userId().equals(request.getCurrentApproverId()) || actor.isAdminOrOwner()) {
            return;
        }
        if (request.getApprovalLevel() == ApprovalLevel.APPROVER && actor.role() != null && actor.role().canApprove()) {
            return;
        }
        throw new ApprovalForbiddenException();
    }

    private void ensureTransition(ApprovalRequest request, ApprovalStatus target, ApprovalAction action) {
        if (!request.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException(request.getStatus().getCode(), action.getCode());
        }
    }

    private ApprovalRequest lockRequest(Long requestId) {
        ApprovalRequest request = approvalRequestMapper.selectByIdForUpdate(requestId);
        if (request == null) {
            throw new NotFoundException("审批请求不存在: %s", requestId);
        }
        return request;
    }

    private void recordEvent(ApprovalRequest request, ApprovalEventType type, ApprovalActor actor,
                             ApprovalStatus from, ApprovalStatus to, String reason, Map<String, Object> metadata) {
        boolean system = actor == null || actor.system();
        ApprovalEvent event = new ApprovalEvent();
        event.setRequestId(request.getId());
        event.setEventType(type);
        event.setPerformedBy(system ? null : actor.userId());
        event.setPerformedBySystem(system);
        event.setFromStatus(from);
        event.setToStatus(to);
        event.setReason(reason);
        event.setMetadata(metadata == null || metadata.isEmpty() ? null : writeJson(metadata));
        event.setCreatedAt(LocalDateTime.now(clock));
        approvalEventMapper.insert(event);
    }

    private Long holdIdOf(ApprovalRequest request) {
        return creditLedgerService.findHoldByRequest(request.getId()).map(CreditHold::getId).orElse(null);
    }

    private long escalationHours(RoutedRule rule) {
        return rule.escalationHours() != null ? rule.escalationHours() : approvalProperties.getDefaultEscalationHours();
    }

    private ApprovalDto.TransitionResult toResult(ApprovalRequest request, Long holdId) {
        ApprovalDto.TransitionResult result = new ApprovalDto.TransitionResult();
        result.setRequestId(request.getId());
        result.setStatus(request.getStatus().getCode());
        result.setApprovalLevel(codeOf(request.getApprovalLevel()));
        result.setCurrentApproverId(request.getCurrentApproverId());
        result.setHoldId(holdId);
        return result;
    }

    private RequestType parseRequestType(String code) {
        if (!StringUtils.hasText(code)) {
            throw new InvalidInputException("请求类型不能为空");
        }
        try {
            return RequestType.fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidInputException("未知请求类型: %s", code);
        }
    }

    private String normalizeReason(String reason) {
        if (!StringUtils.hasText(reason)) {
            return null;
        }
        String trimmed = reason.trim();
        if (trimmed.length() > MAX_REASON_LENGTH) {
            throw new InvalidInputException("原因长度不能超过%s个字符", MAX_REASON_LENGTH);
        }
        return trimmed;
    }

    private String writeJson(Map<String, ?> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new InternalException(ex, "审批数据序列化失败");
        }
    }

    private static String codeOf(ApprovalLevel level) {
        return level == null ? null : level.getCode();
    }

    private static Map<String, Object> metadata(Object... pairs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                metadata.put(String.valueOf(pairs[i]), pairs[i + 1]);
            }
        }
        return metadata;
    }

    private long resolveCurrent(int limit, int offset) {
        if (limit <= 0) {
            return 1;
        }
        return offset / limit + 1;
    }
}
