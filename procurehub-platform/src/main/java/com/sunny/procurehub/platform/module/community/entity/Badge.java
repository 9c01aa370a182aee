package com.sunny.procurehub.platform.module.community.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * 徽章目录
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("badges")
public class Badge {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("slug")
    private String slug;

    @TableField("name")
    private String name;

    @TableField("description")
    private String description;

    @TableField("tier")
    private String tier;

    @TableField("criteria_type")
    private String criteriaType;

    @TableField("threshold")
    private Integer threshold;
}
