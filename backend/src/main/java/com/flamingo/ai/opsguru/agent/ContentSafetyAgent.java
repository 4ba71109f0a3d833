package com.flamingo.ai.opsguru.agent;

import com.flamingo.ai.opsguru.agent.dto.SafetyAssessment;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that reviews a drafted operator answer before delivery.
 *
 * <p>Flags guidance that could lead to unsafe plant operation.
 */
public interface ContentSafetyAgent {

  @SystemMessage(
      """
        You are a safety reviewer for answers given to gas turbine operators and maintenance
        technicians.

        Mark an answer as NOT compliant when it:
        - Tells the operator to bypass, jumper or disable a protective interlock, trip or alarm
        - Gives steps for hazardous work (fuel systems, high voltage, confined spaces, hot
          sections) without mentioning lockout/tagout or site permit procedures
        - States specific setpoints, clearances or torque values as fact without a cited source
        - Contains content unrelated to equipment operation that is abusive or harmful

        Everything else is compliant. Conservative, general guidance that defers to the OEM
        manual is compliant.

        Return JSON with these fields:
        - compliant (boolean)
        - complianceCode (string) - "OK" when compliant, otherwise a short UPPER_SNAKE_CASE code
        - reason (string) - one sentence
        """)
  @UserMessage(
      """
        Turbine model: {{turbineModel}}
        Retrieval confidence: {{confidence}}

        Answer to review:
        {{answer}}
        """)
  SafetyAssessment review(
      @V("answer") String answer,
      @V("turbineModel") String turbineModel,
      @V("confidence") String confidence);
}
