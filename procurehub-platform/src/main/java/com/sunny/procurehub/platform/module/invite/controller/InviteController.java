package com.sunny.procurehub.platform.module.invite.controller;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.procurehub.common.response.ApiResponse;
import com.sunny.procurehub.platform.module.invite.dto.InviteDto;
import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.service.InviteService;
import com.sunny.procurehub.platform.security.AuthContext;
import com.sunny.procurehub.platform.security.ClientIpResolver;
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
 * 邀请控制器
 * 负责邀请创建、列表与公开校验接口
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Tag(name = "邀请", description = "邀请接口")
@RestController
@RequestMapping("/invites")
@RequiredArgsConstructor
public class InviteController {

    private static final int DEFAULT_LIMIT = 20;
    private static final int MAX_LIMIT = 200;

    private final InviteService inviteService;
    private final ClientIpResolver clientIpResolver;

    @Operation(summary = "创建邀请")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<InviteDto.CreateResponse> create(@Valid @RequestBody InviteDto.Create dto,
                                                        HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        return ApiResponse.ok(inviteService.createInvite(context.userId(), dto));
    }

    @Operation(summary = "我发出的邀请")
    @GetMapping
    public ApiResponse<List<InviteDto.Response>> list(@RequestParam(required = false) Integer limit,
                                                      @RequestParam(required = false) Integer offset,
                                                      HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        int resolvedLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int resolvedOffset = offset == null || offset < 0 ? 0 : offset;
        IPage<Invite> page = inviteService.listInvites(context.userId(), resolvedLimit, resolvedOffset);
        List<InviteDto.Response> records = page.getRecords().stream().map(this::toResponse).toList();
        return ApiResponse.page(records, resolvedLimit, resolvedOffset, page.getTotal());
    }

    @Operation(summary = "校验邀请码")
    @GetMapping("/validate/{code}")
    public ApiResponse<InviteDto.Validation> validate(@PathVariable String code,
                                                      @RequestParam(required = false) String email,
                                                      HttpServletRequest request) {
        return ApiResponse.ok(inviteService.validateInvite(code, email, clientIpResolver.resolve(request)));
    }

    private InviteDto.Response toResponse(Invite invite) {
        InviteDto.Response response = new InviteDto.Response();
        response.setId(invite.getId());
        response.setCode(invite.getCode());
        response.setType(invite.getInviteType().getCode());
        response.setEmail(invite.getEmail());
        response.setMaxUses(invite.getMaxUses());
        response.setUseCount(invite.getUseCount());
        response.setExpiresAt(invite.getExpiresAt());
        response.setCreatedAt(invite.getCreatedAt());
        return response;
    }
}
