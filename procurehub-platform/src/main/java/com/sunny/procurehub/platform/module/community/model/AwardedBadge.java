package com.sunny.procurehub.platform.module.community.model;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 用户徽章查询结果
 */
@Data
public class AwardedBadge {
    private Long badgeId;
    private String slug;
    private String name;
    private String description;
    private String tier;
    private LocalDateTime awardedAt;
}
