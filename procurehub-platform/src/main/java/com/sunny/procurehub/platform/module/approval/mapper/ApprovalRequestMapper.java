package com.sunny.procurehub.platform.module.approval.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRequest;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 审批请求 Mapper
 */
@Mapper
public interface ApprovalRequestMapper extends BaseMapper<ApprovalRequest> {

    /**
     * 请求行锁是审批流转的第一把锁，之后才是冻结与账户
     */
    @Select("SELECT * FROM approval_requests WHERE id = #{id} FOR UPDATE")
    ApprovalRequest selectByIdForUpdate(@Param("id") Long id);

    @Select("SELECT id FROM approval_requests WHERE status = 'pending' AND expires_at < #{now} "
            + "ORDER BY expires_at, id LIMIT #{limit}")
    List<Long> selectOverduePendingIds(@Param("now") LocalDateTime now, @Param("limit") int limit);
}
