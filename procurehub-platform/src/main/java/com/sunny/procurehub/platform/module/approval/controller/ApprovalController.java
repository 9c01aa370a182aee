package com.sunny.procurehub.platform.module.approval.controller;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.procurehub.common.response.ApiResponse;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.module.approval.dto.ApprovalDto;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalEvent;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRequest;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalAction;
import com.sunny.procurehub.platform.module.approval.model.ApprovalActor;
import com.sunny.procurehub.platform.module.approval.service.ApprovalService;
import com.sunny.procurehub.platform.security.AuthContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 审批控制器
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Tag(name = "审批", description = "审批请求与流转接口")
@RestController
@RequestMapping("/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private static final int DEFAULT_LIMIT = 20;
    private static final int MAX_LIMIT = 100;

    private final ApprovalService approvalService;

    @Operation(summary = "创建审批请求")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ApprovalDto.Response> create(@Valid @RequestBody ApprovalDto.Create dto,
                                                    HttpServletRequest request) {
        ApprovalActor actor = ApprovalActor.of(AuthContext.require(request));
        return ApiResponse.ok(toResponse(approvalService.createRequest(actor, dto)));
    }

    @Operation(summary = "审批流转", description = "action 取值 submit/approve/deny/cancel/fulfill/escalate")
    @PostMapping("/{id}/{action}")
    public ApiResponse<ApprovalDto.TransitionResult> transition(@PathVariable Long id,
                                                                @PathVariable String action,
                                                                @Valid @RequestBody(required = false)
                                                                ApprovalDto.Transition payload,
                                                                HttpServletRequest request) {
        ApprovalActor actor = ApprovalActor.of(AuthContext.require(request));
        return ApiResponse.ok(approvalService.transition(id, parseAction(action), actor, payload));
    }

    @Operation(summary = "待我审批")
    @GetMapping("/queue")
    public ApiResponse<List<ApprovalDto.Response>> queue(@RequestParam(required = false) Integer limit,
                                                         @RequestParam(required = false) Integer offset,
                                                         HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        int resolvedLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int resolvedOffset = offset == null || offset < 0 ? 0 : offset;
        IPage<ApprovalRequest> page = approvalService.listPendingForApprover(context.userId(), resolvedLimit,
                resolvedOffset);
        List<ApprovalDto.Response> records = page.getRecords().stream().map(this::toResponse).toList();
        return ApiResponse.page(records, resolvedLimit, resolvedOffset, page.getTotal());
    }

    @Operation(summary = "我发起的审批")
    @GetMapping("/mine")
    public ApiResponse<List<ApprovalDto.Response>> mine(@RequestParam(required = false) Integer limit,
                                                        @RequestParam(required = false) Integer offset,
                                                        HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        int resolvedLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int resolvedOffset = offset == null || offset < 0 ? 0 : offset;
        IPage<ApprovalRequest> page = approvalService.listByRequester(context.userId(), resolvedLimit, resolvedOffset);
        List<ApprovalDto.Response> records = page.getRecords().stream().map(this::toResponse).toList();
        return ApiResponse.page(records, resolvedLimit, resolvedOffset, page.getTotal());
    }

    @Operation(summary = "审批事件")
    @GetMapping("/{id}/events")
    public ApiResponse<List<ApprovalDto.EventResponse>> events(@PathVariable Long id, HttpServletRequest request) {
        ApprovalActor actor = ApprovalActor.of(AuthContext.require(request));
        List<ApprovalDto.EventResponse> events = approvalService.listEvents(id, actor).stream()
                .map(this::toEventResponse)
                .toList();
        return ApiResponse.ok(events);
    }

    private ApprovalAction parseAction(String action) {
        try {
            return ApprovalAction.fromCode(action);
        } catch (IllegalArgumentException ex) {
            throw new InvalidInputException("未知审批动作: %s", action);
        }
    }

    private ApprovalDto.Response toResponse(ApprovalRequest approval) {
        ApprovalDto.Response response = new ApprovalDto.Response();
        response.setId(approval.getId());
        response.setCompanyId(approval.getCompanyId());
        response.setTeamId(approval.getTeamId());
        response.setRequesterId(approval.getRequesterId());
        response.setRequestType(approval.getRequestType().getCode());
        response.setStatus(approval.getStatus().getCode());
        response.setTitle(approval.getTitle());
        response.setDescription(approval.getDescription());
        response.setEstimatedCredits(approval.getEstimatedCredits());
        response.setActualCredits(approval.getActualCredits());
        response.setApprovalLevel(approval.getApprovalLevel() == null ? null : approval.getApprovalLevel().getCode());
        response.setCurrentApproverId(approval.getCurrentApproverId());
        response.setEscalationCount(approval.getEscalationCount());
        response.setDecisionReason(approval.getDecisionReason());
        response.setCreatedAt(approval.getCreatedAt());
        response.setSubmittedAt(approval.getSubmittedAt());
        response.setDecidedAt(approval.getDecidedAt());
        response.setExpiresAt(approval.getExpiresAt());
        return response;
    }

    private ApprovalDto.EventResponse toEventResponse(ApprovalEvent event) {
        ApprovalDto.EventResponse response = new ApprovalDto.EventResponse();
        response.setId(event.getId());
        response.setEventType(event.getEventType().getCode());
        response.setPerformedBy(event.getPerformedBy());
        response.setPerformedBySystem(Boolean.TRUE.equals(event.getPerformedBySystem()));
        response.setFromStatus(event.getFromStatus() == null ? null : event.getFromStatus().getCode());
        response.setToStatus(event.getToStatus() == null ? null : event.getToStatus().getCode());
        response.setReason(event.getReason());
        response.setMetadata(event.getMetadata());
        response.setCreatedAt(event.getCreatedAt());
        return response;
    }
}
