package my.projectfinance.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.projectfinance.app.dto.DebtEvaluationRequestDto;
import my.projectfinance.app.dto.DebtEvaluationResponseDto;
import my.projectfinance.app.dto.MixRequestDto;
import my.projectfinance.app.dto.MixResponseDto;
import my.projectfinance.app.dto.RefinancingRequestDto;
import my.projectfinance.app.dto.RefinancingResponseDto;
import my.projectfinance.app.service.DebtStructuringService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/debt")
@Tag(name = "Debt Structuring")
public class DebtStructuringController {
	private final DebtStructuringService debtStructuringService;

	public DebtStructuringController(DebtStructuringService debtStructuringService) {
		this.debtStructuringService = debtStructuringService;
	}

	@PostMapping("/evaluate")
	@Operation(summary = "Build the debt schedule and coverage metrics for a tranche structure")
	public DebtEvaluationResponseDto evaluate(@Valid @RequestBody DebtEvaluationRequestDto request) {
		return debtStructuringService.evaluate(request);
	}

	@PostMapping("/refinance")
	@Operation(summary = "Compare a structure against a refinancing alternative")
	public RefinancingResponseDto refinance(@Valid @RequestBody RefinancingRequestDto request) {
		return debtStructuringService.refinance(request);
	}

	@PostMapping("/mix")
	@Operation(summary = "Size domestic, commercial and DFI tranches from a debt quantum and mix limits")
	public MixResponseDto mix(@Valid @RequestBody MixRequestDto request) {
		return debtStructuringService.solveMix(request);
	}
}
