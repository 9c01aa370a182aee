package com.sunny.procurehub.platform.module.ledger.controller;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.procurehub.common.exception.NotFoundException;
import com.sunny.procurehub.common.response.ApiResponse;
import com.sunny.procurehub.platform.module.ledger.dto.LedgerDto;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import com.sunny.procurehub.platform.module.ledger.entity.LedgerEntry;
import com.sunny.procurehub.platform.module.ledger.service.CreditLedgerService;
import com.sunny.procurehub.platform.security.AuthContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 积分控制器
 * 账户由当前用户所属公司确定
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Tag(name = "积分", description = "积分余额与流水接口")
@RestController
@RequestMapping("/credits")
@RequiredArgsConstructor
public class CreditController {

    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 100;

    private final CreditLedgerService creditLedgerService;

    @Operation(summary = "积分余额")
    @GetMapping("/balance")
    public ApiResponse<LedgerDto.Balance> balance(HttpServletRequest request) {
        CreditAccount account = requireAccount(request);
        return ApiResponse.ok(creditLedgerService.balance(account.getId()));
    }

    @Operation(summary = "积分流水")
    @GetMapping("/transactions")
    public ApiResponse<List<LedgerDto.EntryResponse>> transactions(@RequestParam(required = false) Integer limit,
                                                                   @RequestParam(required = false) Integer offset,
                                                                   HttpServletRequest request) {
        CreditAccount account = requireAccount(request);
        int resolvedLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int resolvedOffset = offset == null || offset < 0 ? 0 : offset;
        IPage<LedgerEntry> page = creditLedgerService.listTransactions(account.getId(), resolvedLimit, resolvedOffset);
        List<LedgerDto.EntryResponse> records = page.getRecords().stream().map(this::toEntryResponse).toList();
        return ApiResponse.page(records, resolvedLimit, resolvedOffset, page.getTotal());
    }

    @Operation(summary = "活跃冻结")
    @GetMapping("/holds")
    public ApiResponse<List<LedgerDto.HoldResponse>> holds(HttpServletRequest request) {
        CreditAccount account = requireAccount(request);
        List<LedgerDto.HoldResponse> holds = creditLedgerService.listActiveHolds(account.getId()).stream()
                .map(this::toHoldResponse)
                .toList();
        return ApiResponse.ok(holds);
    }

    private CreditAccount requireAccount(HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        return creditLedgerService.findAccountByCompany(context.companyId())
                .orElseThrow(() -> new NotFoundException("当前用户未关联积分账户"));
    }

    private LedgerDto.EntryResponse toEntryResponse(LedgerEntry entry) {
        LedgerDto.EntryResponse response = new LedgerDto.EntryResponse();
        response.setId(entry.getId());
        response.setDirection(entry.getDirection().getCode());
        response.setAmount(entry.getAmount());
        response.setTransactionType(entry.getTransactionType().getCode());
        response.setReferenceType(entry.getReferenceType());
        response.setReferenceId(entry.getReferenceId());
        response.setDescription(entry.getDescription());
        response.setActorId(entry.getActorId());
        response.setCreatedAt(entry.getCreatedAt());
        return response;
    }

    private LedgerDto.HoldResponse toHoldResponse(CreditHold hold) {
        LedgerDto.HoldResponse response = new LedgerDto.HoldResponse();
        response.setId(hold.getId());
        response.setRequestId(hold.getRequestId());
        response.setAmount(hold.getAmount());
        response.setStatus(hold.getStatus().getCode());
        response.setCreatedAt(hold.getCreatedAt());
        response.setConvertedAt(hold.getConvertedAt());
        response.setReleasedAt(hold.getReleasedAt());
        return response;
    }
}
