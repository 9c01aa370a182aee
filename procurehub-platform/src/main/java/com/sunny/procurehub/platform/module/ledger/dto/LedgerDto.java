package com.sunny.procurehub.platform.module.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 积分账本 DTO
 */
public class LedgerDto {

    @Data
    @Schema(name = "CreditBalance")
    public static class Balance {
        private Long accountId;
        private Long companyId;
        private long totalCredits;
        private long bonusCredits;
        private long ledgerCredits;
        private long ledgerDebits;
        private long reservedCredits;
        private long availableCredits;
        private String subscriptionTier;
        private LocalDate subscriptionEnd;
        private long daysRemaining;
    }

    @Data
    @Schema(name = "CreditHoldResult")
    public static class HoldResult {
        private Long holdId;
        private long amount;
        private String status;
        private long availableCredits;
        /**
         * false 表示按幂等键返回了已有冻结
         */
        private boolean created;
    }

    @Data
    @Schema(name = "CreditReleaseResult")
    public static class ReleaseResult {
        private Long holdId;
        private String status;
        /**
         * 冻结此前已释放或已转换，本次未做任何变更
         */
        private boolean alreadyTerminal;
        private long availableCredits;
    }

    @Data
    @Schema(name = "LedgerEntryResult")
    public static class EntryResult {
        private Long entryId;
        private long amount;
        private long availableCredits;
        /**
         * 幂等重放，返回的是已存在的分录
         */
        private boolean replayed;
    }

    @Data
    @Schema(name = "LedgerEntry")
    public static class EntryResponse {
        private Long id;
        private String direction;
        private Long amount;
        private String transactionType;
        private String referenceType;
        private String referenceId;
        private String description;
        private Long actorId;
        private LocalDateTime createdAt;
    }

    @Data
    @Schema(name = "CreditHold")
    public static class HoldResponse {
        private Long id;
        private Long requestId;
        private Long amount;
        private String status;
        private LocalDateTime createdAt;
        private LocalDateTime convertedAt;
        private LocalDateTime releasedAt;
    }

    /**
     * 直接记账参数，借贷方向由交易类型决定
     */
    @Data
    public static class PostEntry {
        @NotNull(message = "账户不能为空")
        private Long accountId;

        @NotNull(message = "金额不能为空")
        @Min(value = 1, message = "金额必须大于0")
        private Long amount;

        @NotBlank(message = "交易类型不能为空")
        private String transactionType;

        @Size(max = 32, message = "引用类型过长")
        private String referenceType;

        @Size(max = 64, message = "引用ID过长")
        private String referenceId;

        @Size(max = 500, message = "描述过长")
        private String description;

        @NotBlank(message = "幂等键不能为空")
        @Size(max = 128, message = "幂等键过长")
        private String idempotencyKey;

        private Long actorId;
    }

    @Data
    public static class OpenAccount {
        @NotNull(message = "公司不能为空")
        private Long companyId;

        @NotBlank(message = "订阅档位不能为空")
        private String subscriptionTier;

        @NotNull(message = "周期开始时间不能为空")
        private LocalDateTime periodStart;

        @NotNull(message = "周期结束时间不能为空")
        private LocalDateTime periodEnd;

        @NotNull(message = "基础额度不能为空")
        @Min(value = 0, message = "基础额度不能为负")
        private Long totalCredits;

        @Min(value = 0, message = "赠送额度不能为负")
        private Long bonusCredits;
    }
}
