/**
 * REST API.
 *
 * <ul>
 *   <li>{@link com.bizplanner.orchestrator.api.QuestionnaireController} - answers, questions and progress</li>
 *   <li>{@link com.bizplanner.orchestrator.api.OrchestratorController} - free-form orchestration</li>
 * </ul>
 */
package com.bizplanner.orchestrator.api;
