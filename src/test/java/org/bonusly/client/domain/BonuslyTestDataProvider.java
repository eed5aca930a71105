package org.bonusly.client.domain;

import java.net.URI;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import net.datafaker.Faker;

public class BonuslyTestDataProvider {
  private static final Faker faker = new Faker();

  public static User createUser() {
    String firstName = faker.name().firstName();
    String lastName = faker.name().lastName();
    String username = (firstName + "." + lastName).toLowerCase().replaceAll("[^a-z.]", "");
    return User.builder()
        .id(faker.internet().uuid())
        .shortName(firstName)
        .fullName(firstName + " " + lastName)
        .displayName(firstName + " " + lastName)
        .username(username)
        .email(username + "@example.com")
        .path("/company/users/" + username)
        .fullPicUrl(URI.create("https://bonus.ly/pics/" + username + "/full.png"))
        .profilePicUrl(URI.create("https://bonus.ly/pics/" + username + "/profile.png"))
        .firstName(firstName)
        .lastName(lastName)
        .createdAt(Instant.now().truncatedTo(ChronoUnit.SECONDS))
        .budgetBoost(0L)
        .userMode(UserMode.NORMAL)
        .country(faker.address().countryCode())
        .timeZone("America/Chicago")
        .canReceive(true)
        .canGive(true)
        .giveAmounts(List.of(1, 5, 10))
        .customProperties(Map.of("department", faker.commerce().department()))
        .status("active")
        .build();
  }

  public static List<User> createUsers(int count) {
    return IntStream.range(0, count).mapToObj(i -> createUser()).toList();
  }

  public static Bonus createBonus() {
    User giver = createUser();
    User receiver = createUser();
    int amount = faker.number().numberBetween(1, 50);
    String reason = "+" + amount + " @" + receiver.username() + " for " + faker.lorem().sentence() + " #teamwork";
    return Bonus.builder()
        .id(faker.internet().uuid())
        .createdAt(Instant.now().truncatedTo(ChronoUnit.SECONDS))
        .reason(reason)
        .reasonDecoded(reason)
        .reasonHtml("<p>" + reason + "</p>")
        .amount(amount)
        .amountWithCurrency(amount + " points")
        .familyAmount(amount)
        .hashtag("#teamwork")
        .giver(giver)
        .receivers(List.of(receiver))
        .build();
  }

  public static List<Bonus> createBonuses(int count) {
    return IntStream.range(0, count).mapToObj(i -> createBonus()).toList();
  }

  public static Webhook createWebhook() {
    return Webhook.builder()
        .id(faker.internet().uuid())
        .url("https://" + faker.internet().domainName() + "/hooks/bonusly")
        .eventTypes(List.of("bonus.created"))
        .build();
  }
}
