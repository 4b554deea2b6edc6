package my.projectfinance.app.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.projectfinance.app.AppApplication.class)
@ActiveProfiles("test")
class DebtStructuringApiIntegrationTest {
	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void evaluatesLevelAnnuity() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [400000, 400000, 400000, 400000, 400000],
				  "tranches": [
				    {
				      "id": "SENIOR",
				      "currency": "DOMESTIC",
				      "principal": 1000000,
				      "rate": 0.08,
				      "tenor_periods": 5,
				      "amortization_style": "ANNUITY"
				    }
				  ]
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.schedule.tranches[0].entries.length()").value(5))
				.andExpect(jsonPath("$.schedule.tranches[0].entries[0].total_service").value(closeTo(250456.45, 0.01)))
				.andExpect(jsonPath("$.schedule.tranches[0].final_balance").value(closeTo(0.0, 1e-6)))
				.andExpect(jsonPath("$.metrics.dscr.count").value(5))
				.andExpect(jsonPath("$.compliance.compliant").value(true))
				.andExpect(jsonPath("$.balloon.notes").value("No material balloon payment"));
	}

	@Test
	void rendersInfiniteDscrAsNull() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [100, 100, 100],
				  "tranches": [
				    {
				      "id": "A",
				      "currency": "DOMESTIC",
				      "principal": 200,
				      "rate": 0.05,
				      "tenor_periods": 3,
				      "grace_periods": 1,
				      "capitalize_grace_interest": true,
				      "amortization_style": "ANNUITY"
				    }
				  ],
				  "covenants": []
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.schedule.tranches[0].entries[0].dscr").value(nullValue()))
				.andExpect(jsonPath("$.schedule.tranches[0].entries[0].capitalized_interest").value(closeTo(10.0, 1e-9)))
				.andExpect(jsonPath("$.metrics.dscr.count").value(2));
	}

	@Test
	void infeasibleSculptReturnsUnprocessableEntity() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [200000, 220000, 50000, 240000],
				  "tranches": [
				    {
				      "id": "B",
				      "currency": "DOMESTIC",
				      "principal": 800000,
				      "rate": 0.10,
				      "tenor_periods": 4,
				      "amortization_style": "SCULPTED",
				      "target_dscr": 1.25
				    }
				  ]
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isUnprocessableEntity())
				.andExpect(jsonPath("$.title").value("Infeasible sculpted schedule"))
				.andExpect(jsonPath("$.detail").value(containsString("period 2")));
	}

	@Test
	void sculptFallbackOverrideReschedulesAsAnnuity() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [200000, 220000, 50000, 240000],
				  "sculpt_fallback": "ANNUITY",
				  "tranches": [
				    {
				      "id": "B",
				      "currency": "DOMESTIC",
				      "principal": 800000,
				      "rate": 0.10,
				      "tenor_periods": 4,
				      "amortization_style": "SCULPTED",
				      "target_dscr": 1.25
				    }
				  ]
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.schedule.tranches[0].fallback_applied").value(true))
				.andExpect(jsonPath("$.schedule.tranches[0].amortization_style").value("ANNUITY"))
				.andExpect(jsonPath("$.notes[0]").value(containsString("period 2")));
	}

	@Test
	void duplicateTrancheIdsAreRejected() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [100, 100],
				  "tranches": [
				    { "id": "A", "currency": "DOMESTIC", "principal": 50, "rate": 0.05, "tenor_periods": 2,
				      "amortization_style": "ANNUITY" },
				    { "id": "A", "currency": "DOMESTIC", "principal": 60, "rate": 0.05, "tenor_periods": 2,
				      "amortization_style": "ANNUITY" }
				  ]
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Invalid debt structure"))
				.andExpect(jsonPath("$.detail").value(containsString("Duplicate")));
	}

	@Test
	void missingTranchesFailValidation() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [100, 100]
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));
	}

	@Test
	void refinanceComparesAlternative() throws Exception {
		String body = """
				{
				  "structure": {
				    "base_currency": "DOMESTIC",
				    "cfads": [400000, 400000, 400000, 400000, 400000, 400000, 400000, 400000],
				    "tranches": [
				      {
				        "id": "SENIOR",
				        "currency": "DOMESTIC",
				        "principal": 1000000,
				        "rate": 0.08,
				        "tenor_periods": 5,
				        "balloon_fraction": 0.2,
				        "amortization_style": "ANNUITY"
				      }
				    ]
				  },
				  "refinancing_period": 5,
				  "candidate_tranches": [
				    {
				      "id": "REFI",
				      "currency": "DOMESTIC",
				      "principal": 1,
				      "rate": 0.07,
				      "tenor_periods": 3,
				      "amortization_style": "ANNUITY"
				    }
				  ]
				}
				""";

		mockMvc.perform(post("/api/debt/refinance")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.refinancing_period").value(5))
				.andExpect(jsonPath("$.refinanced_balance").value(closeTo(200000.0, 1e-6)))
				.andExpect(jsonPath("$.alternative.schedule.periods[0].period").value(5))
				.andExpect(jsonPath("$.original_balloon.feasible").value(false));
	}

	@Test
	void mixSizesTranchesWithCommercialFloor() throws Exception {
		String body = """
				{
				  "debt_total": 1000000,
				  "base_currency": "DOMESTIC",
				  "exchange_rates": [2.0],
				  "domestic_max_share": 0.6,
				  "dfi_max_share": 0.4,
				  "commercial_min_share": 0.3,
				  "domestic_rate": 0.12,
				  "commercial_rate": 0.08,
				  "dfi_rate": 0.06,
				  "tenor_periods": 10,
				  "interest_only_periods": 2
				}
				""";

		mockMvc.perform(post("/api/debt/mix")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.domestic_amount").value(closeTo(300000.0, 1e-6)))
				.andExpect(jsonPath("$.commercial_amount").value(closeTo(300000.0, 1e-6)))
				.andExpect(jsonPath("$.dfi_amount").value(closeTo(400000.0, 1e-6)))
				.andExpect(jsonPath("$.tranches.length()").value(3))
				.andExpect(jsonPath("$.tranches[1].id").value("COMMERCIAL"))
				.andExpect(jsonPath("$.tranches[1].currency").value("HARD_CURRENCY"))
				.andExpect(jsonPath("$.tranches[1].principal").value(closeTo(150000.0, 1e-6)))
				.andExpect(jsonPath("$.tranches[2].grace_periods").value(2));
	}

	@Test
	void mixRejectsShareAboveOne() throws Exception {
		String body = """
				{
				  "debt_total": 1000000,
				  "base_currency": "DOMESTIC",
				  "domestic_max_share": 1.5,
				  "domestic_rate": 0.12,
				  "commercial_rate": 0.08,
				  "dfi_rate": 0.06,
				  "tenor_periods": 10
				}
				""";

		mockMvc.perform(post("/api/debt/mix")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));
	}

	@Test
	void balloonOfShorterTrancheCarriesIntoConsolidatedBalance() throws Exception {
		String body = """
				{
				  "base_currency": "DOMESTIC",
				  "cfads": [600000, 600000, 600000, 600000, 600000, 600000],
				  "tranches": [
				    { "id": "A", "currency": "DOMESTIC", "principal": 1000000, "rate": 0.08, "tenor_periods": 3,
				      "balloon_fraction": 0.2, "amortization_style": "ANNUITY" },
				    { "id": "B", "currency": "DOMESTIC", "principal": 1000000, "rate": 0.08, "tenor_periods": 6,
				      "amortization_style": "ANNUITY" }
				  ]
				}
				""";

		mockMvc.perform(post("/api/debt/evaluate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.schedule.periods[2].closing_balance").value(closeTo(757465.72, 1e-6)))
				.andExpect(jsonPath("$.schedule.periods[3].opening_balance").value(closeTo(757465.72, 1e-6)))
				.andExpect(jsonPath("$.schedule.periods[5].closing_balance").value(closeTo(200000.0, 1e-6)));
	}
}
