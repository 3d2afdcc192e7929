package cn.bitsleep.sysdocs.service;

import cn.bitsleep.sysdocs.domain.User;

public record LoginResult(User user, String token) {
}
