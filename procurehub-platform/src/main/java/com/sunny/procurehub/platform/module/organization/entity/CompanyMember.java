package com.sunny.procurehub.platform.module.organization.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 公司成员
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("company_members")
public class CompanyMember {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("company_id")
    private Long companyId;

    @TableField("user_id")
    private Long userId;

    @TableField("team_id")
    private Long teamId;

    @TableField("member_role")
    private OrgRole memberRole;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
