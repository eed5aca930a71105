package org.bonusly.client.domain;

import lombok.Builder;

/**
 * Body of {@code POST /bonuses}. Two forms are accepted:
 * <ul>
 *   <li>simple: only {@code reason}, written the way it would be typed in the app, e.g.
 *       {@code "+10 @alice for the release #teamwork"}</li>
 *   <li>expanded: {@code receiverEmail}, {@code amount} and {@code reason}, with optional
 *       {@code giverEmail} (admin tokens only) and {@code hashtag}</li>
 * </ul>
 * Null fields are left out of the request.
 */
@Builder
public record CreateBonusRequest(
    String reason,
    String giverEmail,
    String receiverEmail,
    Integer amount,
    String hashtag
) {

  public static CreateBonusRequest simple(String reason) {
    return CreateBonusRequest.builder().reason(reason).build();
  }
}
