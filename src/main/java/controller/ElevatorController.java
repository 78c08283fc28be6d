package controller;

import common.Result;
import jakarta.servlet.http.HttpServletRequest;
import model.bo.TaskRecord;
import model.dto.request.CallElevatorReq;
import model.dto.response.AssignmentResult;
import model.dto.response.CallElevatorResp;
import model.dto.snapshot.ElevatorSnapshotDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.dispatch.DispatchService;

/**
 * 呼梯与电梯状态接口
 */
@RestController
@RequestMapping("/api/elevator")
public class ElevatorController {

    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final DispatchService dispatchService;

    public ElevatorController(DispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    // 呼梯: POST /api/elevator/call
    @PostMapping("/call")
    public Result call(@RequestBody CallElevatorReq req,
                       @RequestHeader(name = IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
                       HttpServletRequest request) {
        AssignmentResult result = dispatchService.assign(req.getFromFloor(), req.getToFloor(),
                request.getRemoteAddr(), idempotencyKey);
        return Result.success("派梯成功", CallElevatorResp.of(result));
    }

    /**
     * 电梯群状态快照
     */
    @GetMapping("/status")
    public Result status() {
        return Result.success("查询成功", dispatchService.getStatus());
    }

    /**
     * 轮询呼梯任务进度
     */
    @GetMapping("/tasks/{taskId}")
    public Result taskStatus(@PathVariable("taskId") String taskId) {
        TaskRecord record = dispatchService.getTaskStatus(taskId);
        return Result.success("查询成功", record);
    }

    /**
     * 切换检修标记
     */
    @PostMapping("/{elevatorId}/maintenance")
    public Result maintenance(@PathVariable("elevatorId") int elevatorId,
                              @RequestParam(name = "enabled") boolean enabled,
                              HttpServletRequest request) {
        ElevatorSnapshotDto snapshot = dispatchService.setMaintenanceMode(elevatorId, enabled, request.getRemoteAddr());
        return Result.success("检修标记已更新", snapshot);
    }
}
