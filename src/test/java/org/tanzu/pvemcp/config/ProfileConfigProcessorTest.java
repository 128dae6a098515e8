package org.tanzu.pvemcp.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProfileConfigProcessorTest {

    private static PveProperties.ProfileProperties passwordProfile(String addr, String... groups) {
        PveProperties.ProfileProperties properties = new PveProperties.ProfileProperties();
        properties.setAddr(addr);
        properties.setUser("root");
        properties.setPassword("secret");
        properties.setGroups(List.of(groups));
        return properties;
    }

    private static ProfileConfigProcessor process(PveProperties properties) {
        ProfileConfigProcessor processor = new ProfileConfigProcessor(properties);
        processor.processProfiles();
        return processor;
    }

    @Test
    void validProfileIsNormalized() {
        PveProperties properties = new PveProperties();
        properties.getProfiles().put("lab", passwordProfile("https://pve1.lab:8006///", "homelab"));

        ProfileConfigProcessor processor = process(properties);

        Profile lab = processor.getProfiles().get("lab");
        assertEquals("https://pve1.lab:8006", lab.getAddress());
        assertEquals("pam", lab.getRealm());
        assertEquals("root@pam", lab.getQualifiedUser());
        assertFalse(lab.usesToken());
        assertTrue(processor.getConfigurationErrors().isEmpty());
    }

    @Test
    void tokenProfileKeepsRealmFromUser() {
        PveProperties.ProfileProperties token = new PveProperties.ProfileProperties();
        token.setAddr("https://pve.dc:8006");
        token.setUser("automation@pve");
        token.setTokenId("mcp");
        token.setTokenSecret("s3cr3t");

        Profile profile = ProfileConfigProcessor.toProfile("dc", token);

        assertTrue(profile.usesToken());
        assertEquals("automation@pve", profile.getQualifiedUser());
        assertNull(profile.getPassword());
    }

    @Test
    void missingFieldsAreReported() {
        PveProperties.ProfileProperties noAddr = passwordProfile(null);
        assertThrows(IllegalArgumentException.class, () -> ProfileConfigProcessor.toProfile("a", noAddr));

        PveProperties.ProfileProperties noUser = passwordProfile("https://pve1:8006");
        noUser.setUser(" ");
        assertThrows(IllegalArgumentException.class, () -> ProfileConfigProcessor.toProfile("a", noUser));

        PveProperties.ProfileProperties noAuth = passwordProfile("https://pve1:8006");
        noAuth.setPassword(null);
        assertThrows(IllegalArgumentException.class, () -> ProfileConfigProcessor.toProfile("a", noAuth));
    }

    @Test
    void passwordAndTokenAreMutuallyExclusive() {
        PveProperties.ProfileProperties both = passwordProfile("https://pve1:8006");
        both.setTokenId("mcp");
        both.setTokenSecret("s3cr3t");

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class,
                () -> ProfileConfigProcessor.toProfile("a", both));
        assertTrue(failure.getMessage().contains("not both"));
    }

    @Test
    void unresolvedPlaceholdersCountAsMissing() {
        PveProperties.ProfileProperties placeholder = passwordProfile("https://pve1:8006");
        placeholder.setPassword("${PVE_PASSWORD}");

        assertThrows(IllegalArgumentException.class, () -> ProfileConfigProcessor.toProfile("a", placeholder));
    }

    @Test
    void invalidProfilesAreSkippedNotFatal() {
        PveProperties properties = new PveProperties();
        properties.getProfiles().put("good", passwordProfile("https://pve1:8006"));
        properties.getProfiles().put("bad", passwordProfile(""));

        ProfileConfigProcessor processor = process(properties);

        assertEquals(List.of("good"), List.copyOf(processor.getProfiles().keySet()));
        assertTrue(processor.getConfigurationErrors().get("bad").contains("addr"));
    }

    @Test
    void groupsResolveToMemberProfilesInConfigurationOrder() {
        PveProperties properties = new PveProperties();
        properties.getProfiles().put("east", passwordProfile("https://east:8006", "prod"));
        properties.getProfiles().put("lab", passwordProfile("https://lab:8006", "test"));
        properties.getProfiles().put("west", passwordProfile("https://west:8006", "prod", "test"));

        ProfileConfigProcessor processor = process(properties);

        assertEquals(List.of("east", "west"), names(processor.resolve("prod")));
        assertEquals(List.of("lab", "west"), names(processor.resolve("test")));
        assertEquals(List.of("lab"), names(processor.resolve("lab")));
        assertEquals(3, processor.resolve(null).size());
        assertEquals(3, processor.resolve("").size());
        assertThrows(IllegalArgumentException.class, () -> processor.resolve("nowhere"));
    }

    @Test
    void groupNamedLikeAProfileIsRejected() {
        PveProperties properties = new PveProperties();
        properties.getProfiles().put("lab", passwordProfile("https://lab:8006"));
        properties.getProfiles().put("east", passwordProfile("https://east:8006", "lab"));

        ProfileConfigProcessor processor = process(properties);

        assertFalse(processor.getGroups().containsKey("lab"));
        assertTrue(processor.getConfigurationErrors().get("east").contains("conflicts"));
        assertEquals(List.of("lab"), names(processor.resolve("lab")));
    }

    @Test
    void secretsAreNotPrinted() {
        PveProperties.ProfileProperties properties = passwordProfile("https://pve1:8006");

        assertFalse(properties.toString().contains("secret"));
        assertFalse(ProfileConfigProcessor.toProfile("a", properties).toString().contains("secret"));
    }

    private static List<String> names(List<Profile> profiles) {
        return profiles.stream().map(Profile::getName).collect(Collectors.toList());
    }
}
