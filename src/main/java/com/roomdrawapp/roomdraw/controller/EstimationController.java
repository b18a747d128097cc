package com.roomdrawapp.roomdraw.controller;

import com.roomdrawapp.roomdraw.dto.common.ApiResponse;
import com.roomdrawapp.roomdraw.dto.estimate.request.EstimateRequest;
import com.roomdrawapp.roomdraw.dto.estimate.response.EstimationResponse;
import com.roomdrawapp.roomdraw.dto.estimate.response.PolicyResponse;
import com.roomdrawapp.roomdraw.service.EstimationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/estimates")
public class EstimationController {

    private final EstimationService estimationService;

    public EstimationController(EstimationService estimationService) {
        this.estimationService = estimationService;
    }

    @PostMapping
    public ApiResponse<EstimationResponse> estimate(@Valid @RequestBody EstimateRequest request) {
        return estimationService.estimate(request);
    }

    @GetMapping("/policy")
    public ApiResponse<PolicyResponse> policy() {
        return estimationService.getPolicy();
    }
}
