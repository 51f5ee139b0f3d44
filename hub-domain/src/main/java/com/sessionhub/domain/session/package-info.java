/**
 * 会话领域：会话注册表、状态迁移规则，以及持久化与自动化客户端的端口定义。
 */
package com.sessionhub.domain.session;
