package io.timezz.backend.activity;

import io.timezz.backend.security.UserContext;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Recent activity of the calling user. */
@RestController
@RequestMapping("/api/v1/activity")
public class ActivityController {

  private final ActivityLogService activityLogService;

  public ActivityController(ActivityLogService activityLogService) {
    this.activityLogService = activityLogService;
  }

  /**
   * @param limit number of items to return (default 50, max 100)
   * @return activity items ordered by occurredAt DESC
   */
  @GetMapping
  public ResponseEntity<List<ActivityItem>> getActivity(
      @RequestParam(defaultValue = "50") int limit) {
    return ResponseEntity.ok(activityLogService.recent(UserContext.requireUserId(), limit));
  }
}
