package top.dhc.netsql.backend.server;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * 基于固定用户表的授权，用户表来自配置文件
 */
public class StaticAuthorizer implements Authorizer {
    // 用户名 -> 密码
    private final Map<String, String> users;

    public StaticAuthorizer(Map<String, String> users) {
        this.users = ImmutableMap.copyOf(users);
    }

    @Override
    public boolean authorize(String username, String password) {
        String expected = users.get(username);
        if(expected == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), password.getBytes(StandardCharsets.UTF_8));
    }
}
