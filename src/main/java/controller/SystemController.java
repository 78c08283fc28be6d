package controller;

import common.Result;
import common.consts.EventTypeEnum;
import model.dto.snapshot.EventLogEntryDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.dispatch.DispatchService;
import service.persistence.PersistenceGateway;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 审计日志与健康检查接口
 */
@RestController
@RequestMapping("/api")
public class SystemController {

    private static final int MAX_LOG_LIMIT = 1000;

    private final PersistenceGateway persistenceGateway;
    private final DispatchService dispatchService;

    public SystemController(PersistenceGateway persistenceGateway, DispatchService dispatchService) {
        this.persistenceGateway = persistenceGateway;
        this.dispatchService = dispatchService;
    }

    /**
     * 分页查询审计日志，最新的在前
     */
    @GetMapping("/elevator/logs")
    public Result listLogs(@RequestParam(name = "limit", defaultValue = "100") int limit,
                           @RequestParam(name = "offset", defaultValue = "0") int offset,
                           @RequestParam(name = "eventType", required = false) EventTypeEnum eventType) {
        int safeLimit = Math.max(0, Math.min(limit, MAX_LOG_LIMIT));
        int safeOffset = Math.max(0, offset);
        List<EventLogEntryDto> entries = persistenceGateway.listEvents(safeLimit, safeOffset, eventType);
        return Result.success("查询成功", entries);
    }

    /**
     * 健康检查：网关可读且调度器可给出快照即视为健康
     */
    @GetMapping("/health")
    public Result health() {
        Map<String, Object> result = new HashMap<>();
        result.put("status", "healthy");
        result.put("elevators", persistenceGateway.listUnitStates().size());
        result.put("systemHealth", dispatchService.getStatus().getSystemHealth());
        return Result.success("查询成功", result);
    }
}
