/*
 * どこで: Duel API
 * 何を: 挑戦・宣言・スイッチ・選択・補正・中止・状態参照のエンドポイントを公開する
 * なぜ: チャットボットなどの表示側から対戦エンジンを操作する入口を提供するため
 */
package com.imperialduel.duel.api;

import com.imperialduel.duel.api.request.ChallengeRequest;
import com.imperialduel.duel.api.request.DeclareRequest;
import com.imperialduel.duel.api.request.ModifierRequest;
import com.imperialduel.duel.api.request.PickRequest;
import com.imperialduel.duel.api.request.SwitchRequest;
import com.imperialduel.duel.api.response.CancelResponse;
import com.imperialduel.duel.api.response.MatchStatusResponse;
import com.imperialduel.duel.api.response.PickResponse;
import com.imperialduel.duel.api.response.RoundResultResponse;
import com.imperialduel.duel.api.response.RulesResponse;
import com.imperialduel.duel.service.DuelService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/duels")
@RequiredArgsConstructor
public class DuelController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final DuelService duelService;

  @GetMapping("/rules")
  public ResponseEntity<RulesResponse> getRules() {
    return ResponseEntity.ok(duelService.rules());
  }

  @PostMapping("/{contextKey}/challenge")
  public ResponseEntity<MatchStatusResponse> challenge(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody ChallengeRequest request) {
    return ResponseEntity.ok(duelService.challenge(contextKey, userId, request));
  }

  @PostMapping("/{contextKey}/accept")
  public ResponseEntity<MatchStatusResponse> accept(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(duelService.accept(contextKey, userId));
  }

  @PostMapping("/{contextKey}/declarations")
  public ResponseEntity<MatchStatusResponse> declare(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody DeclareRequest request) {
    return ResponseEntity.ok(duelService.declare(contextKey, userId, request));
  }

  @PostMapping("/{contextKey}/switches")
  public ResponseEntity<MatchStatusResponse> switchStance(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody SwitchRequest request) {
    return ResponseEntity.ok(duelService.switchStance(contextKey, userId, request));
  }

  @PostMapping("/{contextKey}/switches/pass")
  public ResponseEntity<MatchStatusResponse> passSwitch(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(duelService.passSwitch(contextKey, userId));
  }

  @PostMapping("/{contextKey}/picks")
  public ResponseEntity<PickResponse> pick(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody PickRequest request) {
    return ResponseEntity.ok(duelService.pick(contextKey, userId, request));
  }

  @PutMapping("/{contextKey}/modifiers")
  public ResponseEntity<MatchStatusResponse> setModifier(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody ModifierRequest request) {
    return ResponseEntity.ok(duelService.setModifier(contextKey, userId, request));
  }

  @GetMapping("/{contextKey}")
  public ResponseEntity<MatchStatusResponse> getStatus(
      @PathVariable("contextKey") String contextKey) {
    return ResponseEntity.ok(duelService.getStatus(contextKey));
  }

  @GetMapping("/{contextKey}/rounds")
  public ResponseEntity<List<RoundResultResponse>> getRounds(
      @PathVariable("contextKey") String contextKey) {
    return ResponseEntity.ok(duelService.getRounds(contextKey));
  }

  @DeleteMapping("/{contextKey}")
  public ResponseEntity<CancelResponse> cancel(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(duelService.cancel(contextKey, userId));
  }

  @PostMapping("/{contextKey}/force-end")
  public ResponseEntity<CancelResponse> forceEnd(
      @PathVariable("contextKey") String contextKey,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(duelService.forceEnd(contextKey, userId));
  }
}
