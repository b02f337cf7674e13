package com.whispers.api.web;

import com.whispers.api.inboxes.InboxUrls;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
class ConfigController {

  private final InboxUrls inboxUrls;

  @Value("${security.session.ttlSeconds:86400}")
  long sessionTtlSeconds;

  @Value("${app.users.requireSelf:false}")
  boolean usersRequireSelf;

  ConfigController(InboxUrls inboxUrls) {
    this.inboxUrls = inboxUrls;
  }

  @GetMapping("/config")
  Object config() {
    return new ConfigResponse("0.1.0", inboxUrls.baseUrl(), sessionTtlSeconds, usersRequireSelf);
  }

  record ConfigResponse(String version, String baseUrl, long sessionTtlSeconds, boolean usersRequireSelf) {}
}
